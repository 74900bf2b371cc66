package uk.gegc.creditledger.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.creditledger.features.billing.api.dto.VerifyPaymentResponse;
import uk.gegc.creditledger.features.billing.application.BillingMetricsService;
import uk.gegc.creditledger.features.billing.application.BillingStructuredLogger;
import uk.gegc.creditledger.features.billing.application.GatewayRetryExecutor;
import uk.gegc.creditledger.features.billing.application.PaymentGateway;
import uk.gegc.creditledger.features.billing.application.PaymentSessionTransitions;
import uk.gegc.creditledger.features.billing.application.ReconciliationService;
import uk.gegc.creditledger.features.billing.application.WalletLedgerService;
import uk.gegc.creditledger.features.billing.domain.exception.SessionExpiredException;
import uk.gegc.creditledger.features.billing.domain.exception.SessionMismatchException;
import uk.gegc.creditledger.features.billing.domain.exception.TerminalGatewayException;
import uk.gegc.creditledger.features.billing.domain.exception.WalletFrozenException;
import uk.gegc.creditledger.features.billing.domain.model.FailureReason;
import uk.gegc.creditledger.features.billing.domain.model.GatewayStatus;
import uk.gegc.creditledger.features.billing.domain.model.PaymentPurpose;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSession;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSessionStatus;
import uk.gegc.creditledger.features.billing.infra.repository.PaymentSessionRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Reconciliation state machine. Transitions before the gateway call are committed first;
 * the gateway result is applied in a later, independent transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationServiceImpl implements ReconciliationService {

    private static final String MISMATCH_MESSAGE = "Payment callback does not match any payment session";

    private final PaymentSessionRepository paymentSessionRepository;
    private final PaymentSessionTransitions transitions;
    private final PaymentGateway paymentGateway;
    private final GatewayRetryExecutor retryExecutor;
    private final WalletLedgerService walletLedgerService;
    private final BillingMetricsService metricsService;
    private final Clock clock;

    @Override
    public VerifyPaymentResponse reconcile(PaymentCallback callback, UUID requestingUserId) {
        UUID invoiceId = callback.invoiceId();
        PaymentSession session = paymentSessionRepository.findById(invoiceId)
                .orElseThrow(() -> mismatch(invoiceId, "unknown invoice"));
        if (requestingUserId != null && !requestingUserId.equals(session.getUserId())) {
            throw mismatch(invoiceId, "session owned by another user");
        }
        if (session.getExternalRef() == null || !session.getExternalRef().equals(callback.externalRef())) {
            throw mismatch(invoiceId, "external reference differs");
        }

        if (session.getStatus().isTerminal()) {
            return settled(session);
        }

        if (!session.isAwaitingSettlement() && !LocalDateTime.now(clock).isBefore(session.getExpiresAt())) {
            if (transitions.expire(invoiceId)) {
                metricsService.incrementSessionsExpired(1);
                logTransition("info", "Payment session {} expired before its callback was reconciled",
                        session, PaymentSessionStatus.EXPIRED, invoiceId);
                throw new SessionExpiredException(invoiceId);
            }
            return settled(reload(invoiceId));
        }

        GatewayStatus gatewayStatus = GatewayStatus.parse(callback.gatewayStatus());
        // once the gateway holds the payment only it decides; a user's return status is not trusted
        if (session.isAwaitingSettlement() && requestingUserId != null) {
            gatewayStatus = GatewayStatus.SUCCESS;
        }
        if (gatewayStatus != GatewayStatus.SUCCESS) {
            return failSession(session, gatewayStatus.toFailureReason(),
                    "Gateway reported status '" + callback.gatewayStatus() + "'");
        }

        if (session.getStatus() == PaymentSessionStatus.PENDING && !transitions.beginVerification(invoiceId)) {
            PaymentSession current = reload(invoiceId);
            if (current.getStatus() != PaymentSessionStatus.VERIFYING) {
                return settled(current);
            }
            // a concurrent callback is verifying too; whoever completes first wins
        }
        logTransition("debug", "Verifying payment session {} with the gateway",
                session, PaymentSessionStatus.VERIFYING, invoiceId);

        // GatewayUnavailableException propagates and leaves the session verifying for a later retry
        PaymentGateway.GatewayVerification verification;
        try {
            verification = retryExecutor.execute("verify_payment",
                    () -> paymentGateway.verifyPayment(invoiceId, session.getExternalRef()));
        } catch (TerminalGatewayException e) {
            return failSession(session, FailureReason.VERIFICATION_FAILED, e.getMessage());
        }

        if (verification.pending()) {
            return awaitSettlement(session, verification.message());
        }
        if (!verification.success()) {
            return failSession(session, FailureReason.VERIFICATION_FAILED, verification.message());
        }
        if (verification.amount() != session.getAmount()) {
            return failSession(session, FailureReason.VERIFICATION_FAILED,
                    "Amount mismatch: session " + session.getAmount() + ", gateway " + verification.amount());
        }

        PaymentSessionTransitions.Completion completion;
        try {
            completion = transitions.complete(invoiceId);
        } catch (WalletFrozenException e) {
            logTransition("error", "Payment {} captured but wallet is frozen; manual refund required",
                    session, PaymentSessionStatus.FAILED, invoiceId);
            return failSession(session, FailureReason.WALLET_FROZEN, e.getMessage());
        }
        if (completion == null) {
            return settled(reload(invoiceId));
        }

        metricsService.incrementSessionCompleted(completion.purpose(), completion.amount());
        logTransition("info", "Payment session {} completed; credited {}",
                session, PaymentSessionStatus.COMPLETED, invoiceId, completion.amount());

        return new VerifyPaymentResponse(true, completionMessage(completion), invoiceId,
                PaymentSessionStatus.COMPLETED, null, false, completion.newBalance());
    }

    private VerifyPaymentResponse awaitSettlement(PaymentSession session, String message) {
        UUID invoiceId = session.getInvoiceId();
        if (!session.isAwaitingSettlement() && !transitions.awaitSettlement(invoiceId)) {
            return settled(reload(invoiceId));
        }
        logTransition("info", "Payment session {} awaits settlement: {}",
                session, PaymentSessionStatus.VERIFYING, invoiceId, message);
        return new VerifyPaymentResponse(false, "Payment is processing; the wallet is credited once it settles",
                invoiceId, PaymentSessionStatus.VERIFYING, null, false, null);
    }

    private VerifyPaymentResponse failSession(PaymentSession session, FailureReason reason, String message) {
        UUID invoiceId = session.getInvoiceId();
        if (!transitions.fail(invoiceId, reason, message)) {
            return settled(reload(invoiceId));
        }
        metricsService.incrementSessionFailed(reason);
        logTransition("warn", "Payment session {} failed ({}): {}",
                session, PaymentSessionStatus.FAILED, invoiceId, reason, message);
        return new VerifyPaymentResponse(false, failureMessage(reason), invoiceId,
                PaymentSessionStatus.FAILED, reason, false, null);
    }

    /**
     * Response for a session that already reached a terminal state.
     */
    private VerifyPaymentResponse settled(PaymentSession session) {
        UUID invoiceId = session.getInvoiceId();
        return switch (session.getStatus()) {
            case COMPLETED -> {
                metricsService.incrementDuplicateCallback();
                log.info("Payment session {} already completed; ignoring repeated callback", invoiceId);
                yield new VerifyPaymentResponse(true, "Payment already processed", invoiceId,
                        PaymentSessionStatus.COMPLETED, null, true,
                        walletLedgerService.getBalance(session.getUserId()));
            }
            case FAILED -> new VerifyPaymentResponse(false, failureMessage(session.getFailureReason()), invoiceId,
                    PaymentSessionStatus.FAILED, session.getFailureReason(), false, null);
            case EXPIRED -> throw new SessionExpiredException(invoiceId);
            case PENDING, VERIFYING -> throw new IllegalStateException(
                    "Payment session " + invoiceId + " is still " + session.getStatus());
        };
    }

    private PaymentSession reload(UUID invoiceId) {
        return paymentSessionRepository.findById(invoiceId)
                .orElseThrow(() -> new IllegalStateException("Payment session vanished: " + invoiceId));
    }

    private SessionMismatchException mismatch(UUID invoiceId, String detail) {
        log.warn("Rejected payment callback for invoice {}: {}", invoiceId, detail);
        return new SessionMismatchException(MISMATCH_MESSAGE);
    }

    private void logTransition(String level, String message, PaymentSession session,
                               PaymentSessionStatus status, Object... args) {
        BillingStructuredLogger.logSessionTransition(log, level, message,
                session.getInvoiceId(), session.getUserId(), status.name(), args);
    }

    private static String completionMessage(PaymentSessionTransitions.Completion completion) {
        if (completion.purpose() == PaymentPurpose.WALLET_TOPUP) {
            return "Payment verified; wallet credited";
        }
        return Boolean.TRUE.equals(completion.tierApplied())
                ? "Payment verified; subscription upgraded"
                : "Payment verified; upgrade no longer applicable, amount credited to wallet";
    }

    private static String failureMessage(FailureReason reason) {
        if (reason == null) {
            return "Payment failed";
        }
        return switch (reason) {
            case CANCELLED -> "Payment was cancelled";
            case EXPIRED -> "Payment expired at the gateway";
            case VERIFICATION_FAILED -> "Payment could not be verified";
            case GATEWAY_ERROR -> "Payment gateway rejected the payment";
            case WALLET_FROZEN -> "Wallet is frozen; the payment will be refunded";
            case FAILED, OTHER -> "Payment failed";
        };
    }
}
