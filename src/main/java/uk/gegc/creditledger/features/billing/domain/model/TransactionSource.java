package uk.gegc.creditledger.features.billing.domain.model;

/**
 * What caused a ledger write. Only {@link #ADJUSTMENT} credits are accepted on a frozen wallet.
 */
public enum TransactionSource {
    TOPUP,
    TIER_PURCHASE,
    WITHDRAWAL,
    ADJUSTMENT
}
