package uk.gegc.creditledger.features.billing.domain.model;

public enum TransactionKind {
    CREDIT,
    DEBIT
}
