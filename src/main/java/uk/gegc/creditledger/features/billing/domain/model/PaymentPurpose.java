package uk.gegc.creditledger.features.billing.domain.model;

public enum PaymentPurpose {
    WALLET_TOPUP,
    SUBSCRIPTION_TIER
}
