package uk.gegc.creditledger.features.billing.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creditledger.features.billing.api.dto.TransactionDto;
import uk.gegc.creditledger.features.billing.domain.model.BillingCycle;
import uk.gegc.creditledger.features.billing.domain.model.FailureReason;
import uk.gegc.creditledger.features.billing.domain.model.PaymentPurpose;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSession;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSessionStatus;
import uk.gegc.creditledger.features.billing.domain.model.TransactionSource;
import uk.gegc.creditledger.features.billing.infra.repository.PaymentSessionRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Each payment session state change as its own short transaction. Reconciliation strings these together
 * around the gateway call so that no transaction is open while the network is in use.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentSessionTransitions {

    public static final String IDEMPOTENCY_PREFIX = "payment-session:";

    public static final Set<PaymentSessionStatus> OPEN = EnumSet.of(PaymentSessionStatus.PENDING, PaymentSessionStatus.VERIFYING);

    private static final int MAX_FAILURE_MESSAGE = 512;

    private final PaymentSessionRepository paymentSessionRepository;
    private final WalletLedgerService walletLedgerService;
    private final SubscriptionTierService subscriptionTierService;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public PaymentSession save(PaymentSession session) {
        return paymentSessionRepository.save(session);
    }

    /**
     * pending -> verifying.
     *
     * @return false if the session was no longer pending
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean beginVerification(UUID invoiceId) {
        return paymentSessionRepository.transition(invoiceId,
                PaymentSessionStatus.PENDING, PaymentSessionStatus.VERIFYING) == 1;
    }

    /**
     * pending/verifying -> failed.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean fail(UUID invoiceId, FailureReason reason, String message) {
        return paymentSessionRepository.markFailed(invoiceId, OPEN, reason, truncate(message)) == 1;
    }

    /**
     * Keeps a verifying session open past its TTL until the gateway settles the payment.
     *
     * @return false if the session was no longer verifying
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean awaitSettlement(UUID invoiceId) {
        return paymentSessionRepository.markAwaitingSettlement(invoiceId) == 1;
    }

    /**
     * pending/verifying -> expired, only once {@code expires_at} has passed and no settlement is outstanding.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean expire(UUID invoiceId) {
        return paymentSessionRepository.expireIfStale(invoiceId, OPEN, LocalDateTime.now(clock)) == 1;
    }

    /**
     * verifying -> completed together with the wallet credit, and for tier purchases the upgrade debit.
     * All of it commits or none of it does.
     *
     * @return null if the session was no longer verifying, so nothing was applied
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Completion complete(UUID invoiceId) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (paymentSessionRepository.markCompleted(invoiceId, now) == 0) {
            return null;
        }
        PaymentSession session = paymentSessionRepository.findById(invoiceId)
                .orElseThrow(() -> new IllegalStateException("Payment session vanished: " + invoiceId));

        String reference = invoiceId.toString();
        String idempotencyKey = IDEMPOTENCY_PREFIX + invoiceId;
        boolean tierPurchase = session.getPurpose() == PaymentPurpose.SUBSCRIPTION_TIER;

        TransactionDto credit = walletLedgerService.credit(session.getUserId(), session.getAmount(),
                TransactionSource.TOPUP,
                tierPurchase ? "Payment for subscription upgrade" : "Wallet top-up",
                reference, idempotencyKey);
        paymentSessionRepository.recordCreditTransaction(invoiceId, credit.id());

        if (!tierPurchase) {
            return new Completion(session.getUserId(), session.getPurpose(), session.getAmount(),
                    credit.balanceAfter(), null);
        }

        BillingCycle cycle = session.getTargetCycle();
        long totalCost = session.getQuotedTotalCost() != null ? session.getQuotedTotalCost() : session.getAmount();
        long creditApplied = session.getQuotedCreditApplied() != null ? session.getQuotedCreditApplied() : 0L;
        boolean upgraded = subscriptionTierService.applyPaidUpgrade(session.getUserId(), session.getTargetTier(),
                cycle, totalCost, creditApplied, session.getAmount(), reference);
        if (!upgraded) {
            return new Completion(session.getUserId(), session.getPurpose(), session.getAmount(),
                    credit.balanceAfter(), false);
        }

        TransactionDto debit = walletLedgerService.debit(session.getUserId(), session.getAmount(),
                TransactionSource.TIER_PURCHASE,
                "Subscription upgrade to tier " + session.getTargetTier()
                        + " (" + cycle.name().toLowerCase(Locale.ROOT) + ")",
                reference, idempotencyKey + ":upgrade");
        return new Completion(session.getUserId(), session.getPurpose(), session.getAmount(),
                debit.balanceAfter(), true);
    }

    public static String truncate(String message) {
        if (message == null || message.length() <= MAX_FAILURE_MESSAGE) {
            return message;
        }
        return message.substring(0, MAX_FAILURE_MESSAGE);
    }

    /**
     * @param tierApplied null for top-ups; for tier purchases whether the upgrade was still applicable
     */
    public record Completion(UUID userId, PaymentPurpose purpose, long amount, long newBalance, Boolean tierApplied) {}
}
