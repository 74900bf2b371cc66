package uk.gegc.creditledger.features.billing.domain.model;

public enum PaymentSessionStatus {
    PENDING,
    VERIFYING,
    COMPLETED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == EXPIRED;
    }
}
