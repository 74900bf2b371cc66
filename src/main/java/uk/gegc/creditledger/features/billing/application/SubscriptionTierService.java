package uk.gegc.creditledger.features.billing.application;

import uk.gegc.creditledger.features.billing.api.dto.PurchaseTierResponse;
import uk.gegc.creditledger.features.billing.api.dto.SubscriptionTiersResponse;
import uk.gegc.creditledger.features.billing.domain.model.BillingCycle;
import uk.gegc.creditledger.features.billing.domain.model.UpgradeQuote;

import java.util.UUID;

/**
 * Subscription tier reads and upgrades. Tiers only ever go up through this service;
 * lapsed subscriptions fall back to the free tier via {@link #revertLapsedSubscriptions()}.
 */
public interface SubscriptionTierService {

    SubscriptionTiersResponse getTierOverview(UUID userId);

    /**
     * Effective tier level: the stored tier, or 0 once {@code expires_at} plus the grace period has passed.
     */
    int getEffectiveTier(UUID userId);

    UpgradeQuote quoteUpgrade(UUID userId, int targetTier, BillingCycle targetCycle);

    /**
     * Pays {@code amount_to_pay} from the wallet and applies the upgrade atomically.
     */
    PurchaseTierResponse purchaseWithWallet(UUID userId, int targetTier, boolean yearly);

    /**
     * Applies an upgrade that was paid through the gateway, using the quote frozen on the payment session.
     * Must run inside the caller's transaction.
     *
     * @return false if the target is no longer an upgrade (e.g. the user upgraded another way meanwhile)
     */
    boolean applyPaidUpgrade(UUID userId, int targetTier, BillingCycle targetCycle,
                             long totalCost, long creditApplied, long amountPaid, String paymentReference);

    /**
     * Reverts every subscription past expiry and grace period to the free tier.
     *
     * @return number of subscriptions reverted
     */
    int revertLapsedSubscriptions();
}
