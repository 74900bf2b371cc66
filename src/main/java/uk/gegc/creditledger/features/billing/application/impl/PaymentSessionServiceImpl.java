package uk.gegc.creditledger.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creditledger.features.billing.api.dto.CheckoutResponse;
import uk.gegc.creditledger.features.billing.api.dto.PaymentSessionDto;
import uk.gegc.creditledger.features.billing.application.BillingMetricsService;
import uk.gegc.creditledger.features.billing.application.BillingProperties;
import uk.gegc.creditledger.features.billing.application.BillingStructuredLogger;
import uk.gegc.creditledger.features.billing.application.GatewayRetryExecutor;
import uk.gegc.creditledger.features.billing.application.PaymentGateway;
import uk.gegc.creditledger.features.billing.application.PaymentSessionService;
import uk.gegc.creditledger.features.billing.application.PaymentSessionTransitions;
import uk.gegc.creditledger.features.billing.application.SubscriptionTierService;
import uk.gegc.creditledger.features.billing.application.TierCatalog;
import uk.gegc.creditledger.features.billing.application.WalletLedgerService;
import uk.gegc.creditledger.features.billing.domain.exception.SessionNotFoundException;
import uk.gegc.creditledger.features.billing.domain.exception.TerminalGatewayException;
import uk.gegc.creditledger.features.billing.domain.model.BillingCycle;
import uk.gegc.creditledger.features.billing.domain.model.FailureReason;
import uk.gegc.creditledger.features.billing.domain.model.PaymentPurpose;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSession;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSessionStatus;
import uk.gegc.creditledger.features.billing.domain.model.UpgradeQuote;
import uk.gegc.creditledger.features.billing.infra.mapping.PaymentSessionMapper;
import uk.gegc.creditledger.features.billing.infra.repository.PaymentSessionRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentSessionServiceImpl implements PaymentSessionService {

    private final PaymentSessionRepository paymentSessionRepository;
    private final PaymentSessionTransitions transitions;
    private final PaymentGateway paymentGateway;
    private final GatewayRetryExecutor retryExecutor;
    private final WalletLedgerService walletLedgerService;
    private final SubscriptionTierService subscriptionTierService;
    private final TierCatalog tierCatalog;
    private final PaymentSessionMapper paymentSessionMapper;
    private final BillingMetricsService metricsService;
    private final BillingProperties billingProperties;
    private final Clock clock;

    @Override
    public CheckoutResponse createTopUpSession(UUID userId, long amount, String paymentMethod) {
        String provider = billingProperties.getGateway().getProvider();
        if (paymentMethod == null || !provider.equalsIgnoreCase(paymentMethod.trim())) {
            throw new IllegalArgumentException("Unsupported payment method: " + paymentMethod);
        }
        if (amount < billingProperties.getMinTopUp() || amount > billingProperties.getMaxTopUp()) {
            throw new IllegalArgumentException("Top-up amount must be between "
                    + billingProperties.getMinTopUp() + " and " + billingProperties.getMaxTopUp());
        }
        walletLedgerService.requireNotFrozen(userId);

        PaymentSession session = newSession(userId, amount, PaymentPurpose.WALLET_TOPUP);
        return open(session, "Wallet top-up");
    }

    @Override
    public CheckoutResponse createTierUpgradeSession(UUID userId, int targetTier, boolean yearly) {
        BillingCycle cycle = BillingCycle.fromYearlyFlag(yearly);
        UpgradeQuote quote = subscriptionTierService.quoteUpgrade(userId, targetTier, cycle);
        if (quote.amountToPay() <= 0) {
            throw new IllegalArgumentException(
                    "Upgrade is fully covered by the current subscription credit; purchase it with the wallet instead");
        }
        walletLedgerService.requireNotFrozen(userId);

        PaymentSession session = newSession(userId, quote.amountToPay(), PaymentPurpose.SUBSCRIPTION_TIER);
        session.setTargetTier(targetTier);
        session.setTargetCycle(cycle);
        session.setQuotedTotalCost(quote.totalCost());
        session.setQuotedCreditApplied(quote.creditApplied());

        String description = "Subscription upgrade to " + tierCatalog.get(targetTier).name()
                + " (" + cycle.name().toLowerCase(Locale.ROOT) + ")";
        return open(session, description);
    }

    @Override
    @Transactional(readOnly = true)
    public PaymentSessionDto getSession(UUID userId, UUID invoiceId) {
        return paymentSessionRepository.findByInvoiceIdAndUserId(invoiceId, userId)
                .map(paymentSessionMapper::toDto)
                .orElseThrow(() -> new SessionNotFoundException(invoiceId));
    }

    @Override
    @Transactional(readOnly = true)
    public PaymentSessionDto getSessionForAdmin(UUID invoiceId) {
        return paymentSessionRepository.findById(invoiceId)
                .map(paymentSessionMapper::toDto)
                .orElseThrow(() -> new SessionNotFoundException(invoiceId));
    }

    @Override
    @Transactional
    public int expireStaleSessions() {
        int expired = paymentSessionRepository.expireStale(PaymentSessionTransitions.OPEN, LocalDateTime.now(clock));
        if (expired > 0) {
            metricsService.incrementSessionsExpired(expired);
        }
        return expired;
    }

    private PaymentSession newSession(UUID userId, long amount, PaymentPurpose purpose) {
        LocalDateTime now = LocalDateTime.now(clock);
        PaymentSession session = new PaymentSession();
        session.setInvoiceId(UUID.randomUUID());
        session.setUserId(userId);
        session.setAmount(amount);
        session.setCurrency(billingProperties.getCurrency());
        session.setPurpose(purpose);
        session.setStatus(PaymentSessionStatus.PENDING);
        session.setCreatedAt(now);
        session.setExpiresAt(now.plus(sessionTtl()));
        return session;
    }

    private CheckoutResponse open(PaymentSession session, String description) {
        UUID invoiceId = session.getInvoiceId();
        Instant gatewayExpiry = clock.instant().plus(sessionTtl());
        PaymentGateway.PaymentRequest request = new PaymentGateway.PaymentRequest(
                invoiceId, session.getAmount(), session.getCurrency(), description, gatewayExpiry);

        PaymentGateway.GatewayCheckout checkout;
        try {
            checkout = retryExecutor.execute("create_payment", () -> paymentGateway.createPayment(request));
        } catch (TerminalGatewayException e) {
            session.setStatus(PaymentSessionStatus.FAILED);
            session.setFailureReason(FailureReason.GATEWAY_ERROR);
            session.setFailureMessage(PaymentSessionTransitions.truncate(e.getMessage()));
            transitions.save(session);
            metricsService.incrementSessionFailed(FailureReason.GATEWAY_ERROR);
            BillingStructuredLogger.logSessionTransition(log, "warn",
                    "Gateway rejected payment session for invoice {}: {}",
                    invoiceId, session.getUserId(), PaymentSessionStatus.FAILED.name(), invoiceId, e.getMessage());
            throw e;
        }

        session.setExternalRef(checkout.externalRef());
        session.setRedirectUrl(checkout.redirectUrl());
        transitions.save(session);
        metricsService.incrementSessionCreated(session.getPurpose(), session.getAmount());

        BillingStructuredLogger.logSessionTransition(log, "info",
                "Opened {} payment session {} for {} (external ref {})",
                invoiceId, session.getUserId(), PaymentSessionStatus.PENDING.name(),
                session.getPurpose(), invoiceId, session.getAmount(), checkout.externalRef());

        return new CheckoutResponse(invoiceId, checkout.externalRef(), checkout.redirectUrl(),
                session.getAmount(), session.getExpiresAt());
    }

    private Duration sessionTtl() {
        return Duration.ofMinutes(billingProperties.getSessionTtlMinutes());
    }
}
