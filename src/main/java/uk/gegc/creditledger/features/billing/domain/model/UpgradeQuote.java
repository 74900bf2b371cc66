package uk.gegc.creditledger.features.billing.domain.model;

/**
 * Result of pricing an upgrade, all amounts in minor currency units.
 * {@code amountToPay == totalCost - creditApplied} and {@code creditApplied <= totalCost}.
 */
public record UpgradeQuote(
        int fromTier,
        int toTier,
        BillingCycle targetCycle,
        long totalCost,
        long creditApplied,
        long amountToPay
) {}
