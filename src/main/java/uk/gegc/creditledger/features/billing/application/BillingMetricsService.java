package uk.gegc.creditledger.features.billing.application;

import uk.gegc.creditledger.features.billing.domain.model.FailureReason;
import uk.gegc.creditledger.features.billing.domain.model.PaymentPurpose;
import uk.gegc.creditledger.features.billing.domain.model.TransactionSource;

import java.util.UUID;

/**
 * Service for emitting billing metrics and observability data.
 */
public interface BillingMetricsService {

    // Ledger
    void recordCredit(UUID ownerId, long amount, TransactionSource source);
    void recordDebit(UUID ownerId, long amount, TransactionSource source);
    void recordDebitRejected(UUID ownerId, String reason);

    // Payment sessions
    void incrementSessionCreated(PaymentPurpose purpose, long amount);
    void incrementSessionCompleted(PaymentPurpose purpose, long amount);
    void incrementSessionFailed(FailureReason reason);
    void incrementSessionsExpired(int count);
    void incrementDuplicateCallback();

    // Gateway
    void incrementGatewayRetry(String operation);
    void incrementGatewayFailure(String operation, boolean retryable);
    void recordGatewayLatency(String operation, long latencyMs);
    void incrementWebhookReceived(String eventType);

    // Ledger audit
    void recordAuditSuccess(UUID ownerId);
    void recordAuditDrift(UUID ownerId, long driftAmount);
    void recordAuditFailure(UUID ownerId, String reason);

    // Subscriptions
    void incrementTierUpgrade(int toTier, String paymentMethod);
    void incrementSubscriptionsLapsed(int count);
}
