package uk.gegc.creditledger.features.billing.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.creditledger.features.billing.application.BillingMetricsService;
import uk.gegc.creditledger.features.billing.domain.model.FailureReason;
import uk.gegc.creditledger.features.billing.domain.model.PaymentPurpose;
import uk.gegc.creditledger.features.billing.domain.model.TransactionSource;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Implementation of billing metrics service.
 * Emits structured metrics for observability and monitoring using Micrometer.
 */
@Slf4j
@Service
public class BillingMetricsServiceImpl implements BillingMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter debitRejectedCounter;
    private final Counter sessionsExpiredCounter;
    private final Counter duplicateCallbackCounter;
    private final Counter auditSuccessCounter;
    private final Counter auditDriftCounter;
    private final Counter auditFailureCounter;
    private final Counter subscriptionsLapsedCounter;

    public BillingMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.debitRejectedCounter = Counter.builder("billing.ledger.debits.rejected")
                .description("Number of debits rejected for insufficient funds or frozen wallets")
                .register(meterRegistry);
        this.sessionsExpiredCounter = Counter.builder("billing.sessions.expired")
                .description("Number of payment sessions expired by the sweeper")
                .register(meterRegistry);
        this.duplicateCallbackCounter = Counter.builder("billing.reconciliation.duplicate")
                .description("Number of callbacks for sessions that were already completed")
                .register(meterRegistry);
        this.auditSuccessCounter = Counter.builder("billing.audit.success")
                .description("Number of wallets whose ledger replay matched the balance")
                .register(meterRegistry);
        this.auditDriftCounter = Counter.builder("billing.audit.drift")
                .description("Number of wallets whose ledger replay did not match the balance")
                .register(meterRegistry);
        this.auditFailureCounter = Counter.builder("billing.audit.failure")
                .description("Number of wallet audits that could not be completed")
                .register(meterRegistry);
        this.subscriptionsLapsedCounter = Counter.builder("billing.subscriptions.lapsed")
                .description("Number of subscriptions reverted to the free tier")
                .register(meterRegistry);
    }

    @Override
    public void recordCredit(UUID ownerId, long amount, TransactionSource source) {
        log.info("METRIC: billing.ledger.credits userId={} amount={} source={}", ownerId, amount, source);
        Counter.builder("billing.ledger.credits")
                .description("Minor units credited to wallets")
                .tag("source", source.name())
                .register(meterRegistry)
                .increment(amount);
    }

    @Override
    public void recordDebit(UUID ownerId, long amount, TransactionSource source) {
        log.info("METRIC: billing.ledger.debits userId={} amount={} source={}", ownerId, amount, source);
        Counter.builder("billing.ledger.debits")
                .description("Minor units debited from wallets")
                .tag("source", source.name())
                .register(meterRegistry)
                .increment(amount);
    }

    @Override
    public void recordDebitRejected(UUID ownerId, String reason) {
        log.warn("METRIC: billing.ledger.debits.rejected userId={} reason={}", ownerId, reason);
        debitRejectedCounter.increment();
    }

    @Override
    public void incrementSessionCreated(PaymentPurpose purpose, long amount) {
        log.info("METRIC: billing.sessions.created purpose={} amount={}", purpose, amount);
        Counter.builder("billing.sessions.created")
                .tag("purpose", purpose.name())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementSessionCompleted(PaymentPurpose purpose, long amount) {
        log.info("METRIC: billing.sessions.completed purpose={} amount={}", purpose, amount);
        Counter.builder("billing.sessions.completed")
                .tag("purpose", purpose.name())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementSessionFailed(FailureReason reason) {
        log.info("METRIC: billing.sessions.failed reason={}", reason);
        Counter.builder("billing.sessions.failed")
                .tag("reason", reason.name())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementSessionsExpired(int count) {
        log.info("METRIC: billing.sessions.expired count={}", count);
        sessionsExpiredCounter.increment(count);
    }

    @Override
    public void incrementDuplicateCallback() {
        log.info("METRIC: billing.reconciliation.duplicate");
        duplicateCallbackCounter.increment();
    }

    @Override
    public void incrementGatewayRetry(String operation) {
        log.info("METRIC: billing.gateway.retries operation={}", operation);
        Counter.builder("billing.gateway.retries")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementGatewayFailure(String operation, boolean retryable) {
        log.warn("METRIC: billing.gateway.failures operation={} retryable={}", operation, retryable);
        Counter.builder("billing.gateway.failures")
                .tag("operation", operation)
                .tag("retryable", String.valueOf(retryable))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordGatewayLatency(String operation, long latencyMs) {
        log.debug("METRIC: billing.gateway.latency operation={} latencyMs={}", operation, latencyMs);
        Timer.builder("billing.gateway.latency")
                .description("Payment gateway call latency")
                .tag("operation", operation)
                .register(meterRegistry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void incrementWebhookReceived(String eventType) {
        log.info("METRIC: billing.webhooks.received eventType={}", eventType);
        Counter.builder("billing.webhooks.received")
                .tag("eventType", eventType)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordAuditSuccess(UUID ownerId) {
        log.info("METRIC: billing.audit.success userId={}", ownerId);
        auditSuccessCounter.increment();
    }

    @Override
    public void recordAuditDrift(UUID ownerId, long driftAmount) {
        log.error("METRIC: billing.audit.drift userId={} driftAmount={}", ownerId, driftAmount);
        auditDriftCounter.increment();
    }

    @Override
    public void recordAuditFailure(UUID ownerId, String reason) {
        log.error("METRIC: billing.audit.failure userId={} reason={}", ownerId, reason);
        auditFailureCounter.increment();
    }

    @Override
    public void incrementTierUpgrade(int toTier, String paymentMethod) {
        log.info("METRIC: billing.subscriptions.upgrades toTier={} method={}", toTier, paymentMethod);
        Counter.builder("billing.subscriptions.upgrades")
                .tag("toTier", String.valueOf(toTier))
                .tag("method", paymentMethod)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementSubscriptionsLapsed(int count) {
        log.info("METRIC: billing.subscriptions.lapsed count={}", count);
        subscriptionsLapsedCounter.increment(count);
    }
}
