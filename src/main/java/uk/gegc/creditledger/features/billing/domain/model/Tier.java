package uk.gegc.creditledger.features.billing.domain.model;

/**
 * One subscription level. Level 0 is the free baseline.
 */
public record Tier(
        int level,
        String name,
        long monthlyPrice,
        long yearlyPrice,
        TierFeatures features
) {

    public long price(BillingCycle cycle) {
        return cycle == BillingCycle.YEARLY ? yearlyPrice : monthlyPrice;
    }

    public boolean isFree() {
        return level == 0;
    }
}
