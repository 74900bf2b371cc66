package uk.gegc.creditledger.features.billing.domain.model;

/**
 * Why a payment session ended in {@link PaymentSessionStatus#FAILED}.
 */
public enum FailureReason {
    CANCELLED,
    FAILED,
    EXPIRED,
    VERIFICATION_FAILED,
    GATEWAY_ERROR,
    WALLET_FROZEN,
    OTHER
}
