package uk.gegc.creditledger.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creditledger.features.billing.api.dto.PurchaseTierResponse;
import uk.gegc.creditledger.features.billing.api.dto.SubscriptionTiersResponse;
import uk.gegc.creditledger.features.billing.api.dto.TransactionDto;
import uk.gegc.creditledger.features.billing.application.BillingMetricsService;
import uk.gegc.creditledger.features.billing.application.BillingProperties;
import uk.gegc.creditledger.features.billing.application.SubscriptionTierService;
import uk.gegc.creditledger.features.billing.application.TierCatalog;
import uk.gegc.creditledger.features.billing.application.UpgradePricingCalculator;
import uk.gegc.creditledger.features.billing.application.WalletLedgerService;
import uk.gegc.creditledger.features.billing.domain.model.BillingCycle;
import uk.gegc.creditledger.features.billing.domain.model.Subscription;
import uk.gegc.creditledger.features.billing.domain.model.Tier;
import uk.gegc.creditledger.features.billing.domain.model.TierPurchase;
import uk.gegc.creditledger.features.billing.domain.model.TransactionSource;
import uk.gegc.creditledger.features.billing.domain.model.UpgradeQuote;
import uk.gegc.creditledger.features.billing.infra.mapping.TierMapper;
import uk.gegc.creditledger.features.billing.infra.repository.SubscriptionRepository;
import uk.gegc.creditledger.features.billing.infra.repository.TierPurchaseRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionTierServiceImpl implements SubscriptionTierService {

    private final SubscriptionRepository subscriptionRepository;
    private final TierPurchaseRepository tierPurchaseRepository;
    private final WalletLedgerService walletLedgerService;
    private final UpgradePricingCalculator pricingCalculator;
    private final TierCatalog tierCatalog;
    private final TierMapper tierMapper;
    private final BillingMetricsService metricsService;
    private final BillingProperties billingProperties;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public SubscriptionTiersResponse getTierOverview(UUID userId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Subscription subscription = subscriptionRepository.findById(userId).orElse(null);
        int effectiveTier = effectiveTier(subscription, now);

        return new SubscriptionTiersResponse(
                tierMapper.toDtos(tierCatalog.all()),
                effectiveTier,
                effectiveTier > 0 ? subscription.getBillingCycle() : null,
                walletLedgerService.getBalance(userId),
                effectiveTier > 0 ? subscription.getExpiresAt() : null
        );
    }

    @Override
    @Transactional(readOnly = true)
    public int getEffectiveTier(UUID userId) {
        return effectiveTier(subscriptionRepository.findById(userId).orElse(null), LocalDateTime.now(clock));
    }

    @Override
    @Transactional(readOnly = true)
    public UpgradeQuote quoteUpgrade(UUID userId, int targetTier, BillingCycle targetCycle) {
        LocalDateTime now = LocalDateTime.now(clock);
        Subscription subscription = subscriptionRepository.findById(userId).orElse(null);
        return quote(subscription, targetTier, targetCycle, now);
    }

    @Override
    @Transactional
    public PurchaseTierResponse purchaseWithWallet(UUID userId, int targetTier, boolean yearly) {
        LocalDateTime now = LocalDateTime.now(clock);
        BillingCycle targetCycle = BillingCycle.fromYearlyFlag(yearly);

        Subscription subscription = getOrCreate(userId, now);
        UpgradeQuote quote = quote(subscription, targetTier, targetCycle, now);
        Tier target = tierCatalog.get(targetTier);

        String reference = "tier-upgrade:" + UUID.randomUUID();
        long newBalance;
        if (quote.amountToPay() > 0) {
            TransactionDto debit = walletLedgerService.debit(userId, quote.amountToPay(), TransactionSource.TIER_PURCHASE,
                    describe(target, targetCycle), reference, null);
            newBalance = debit.balanceAfter();
        } else {
            newBalance = walletLedgerService.getBalance(userId);
        }

        int fromTier = quote.fromTier();
        applyUpgrade(subscription, targetTier, targetCycle, now);
        recordPurchase(userId, fromTier, targetTier, targetCycle, quote.totalCost(), quote.creditApplied(),
                quote.amountToPay(), TierPurchase.PaymentMethod.WALLET, reference, now);
        metricsService.incrementTierUpgrade(targetTier, "wallet");

        log.info("User {} upgraded from tier {} to {} ({}) paying {} from wallet (credit applied {})",
                userId, fromTier, targetTier, targetCycle, quote.amountToPay(), quote.creditApplied());

        return new PurchaseTierResponse(
                "Successfully upgraded to " + target.name(),
                newBalance,
                targetTier,
                subscription.getExpiresAt(),
                tierMapper.toDto(quote)
        );
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean applyPaidUpgrade(UUID userId, int targetTier, BillingCycle targetCycle,
                                    long totalCost, long creditApplied, long amountPaid, String paymentReference) {
        LocalDateTime now = LocalDateTime.now(clock);
        Subscription subscription = getOrCreate(userId, now);
        int current = effectiveTier(subscription, now);
        if (targetTier <= current) {
            log.warn("Paid upgrade {} for user {} to tier {} is no longer an upgrade from tier {}",
                    paymentReference, userId, targetTier, current);
            return false;
        }

        applyUpgrade(subscription, targetTier, targetCycle, now);
        recordPurchase(userId, current, targetTier, targetCycle, totalCost, creditApplied, amountPaid,
                TierPurchase.PaymentMethod.GATEWAY, paymentReference, now);
        metricsService.incrementTierUpgrade(targetTier, "gateway");
        log.info("User {} upgraded from tier {} to {} ({}) via payment {}",
                userId, current, targetTier, targetCycle, paymentReference);
        return true;
    }

    @Override
    @Transactional
    public int revertLapsedSubscriptions() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime cutoff = now.minus(billingProperties.getSubscriptionGracePeriod());

        List<Subscription> lapsed = subscriptionRepository.findByCurrentTierGreaterThanAndExpiresAtBefore(0, cutoff);
        for (Subscription subscription : lapsed) {
            log.info("Subscription of user {} at tier {} expired at {}; reverting to free tier",
                    subscription.getUserId(), subscription.getCurrentTier(), subscription.getExpiresAt());
            subscription.setCurrentTier(0);
            subscription.setBillingCycle(BillingCycle.MONTHLY);
            subscription.setExpiresAt(null);
            subscription.setUpdatedAt(now);
        }
        if (!lapsed.isEmpty()) {
            metricsService.incrementSubscriptionsLapsed(lapsed.size());
        }
        return lapsed.size();
    }

    private UpgradeQuote quote(Subscription subscription, int targetTier, BillingCycle targetCycle, LocalDateTime now) {
        int current = effectiveTier(subscription, now);
        BillingCycle currentCycle = subscription != null ? subscription.getBillingCycle() : BillingCycle.MONTHLY;
        LocalDateTime expiresAt = current > 0 ? subscription.getExpiresAt() : null;
        return pricingCalculator.computeUpgrade(current, currentCycle, expiresAt, targetTier, targetCycle, now);
    }

    private int effectiveTier(Subscription subscription, LocalDateTime now) {
        if (subscription == null || subscription.getCurrentTier() == 0) {
            return 0;
        }
        LocalDateTime expiresAt = subscription.getExpiresAt();
        if (expiresAt != null && !now.isBefore(expiresAt.plus(billingProperties.getSubscriptionGracePeriod()))) {
            return 0;
        }
        return subscription.getCurrentTier();
    }

    private Subscription getOrCreate(UUID userId, LocalDateTime now) {
        return subscriptionRepository.findById(userId)
                .orElseGet(() -> {
                    Subscription created = new Subscription();
                    created.setUserId(userId);
                    created.setCurrentTier(0);
                    created.setBillingCycle(BillingCycle.MONTHLY);
                    created.setStartedAt(now);
                    created.setUpdatedAt(now);
                    return subscriptionRepository.save(created);
                });
    }

    private void applyUpgrade(Subscription subscription, int targetTier, BillingCycle targetCycle, LocalDateTime now) {
        subscription.setCurrentTier(targetTier);
        subscription.setBillingCycle(targetCycle);
        subscription.setStartedAt(now);
        subscription.setExpiresAt(now.plus(targetCycle.getLength()));
        subscription.setUpdatedAt(now);
        subscriptionRepository.save(subscription);
    }

    private void recordPurchase(UUID userId, int fromTier, int toTier, BillingCycle cycle,
                                long totalCost, long creditApplied, long amountPaid,
                                TierPurchase.PaymentMethod method, String reference, LocalDateTime now) {
        TierPurchase purchase = new TierPurchase();
        purchase.setUserId(userId);
        purchase.setFromTier(fromTier);
        purchase.setToTier(toTier);
        purchase.setBillingCycle(cycle);
        purchase.setTotalCost(totalCost);
        purchase.setCreditApplied(creditApplied);
        purchase.setAmountPaid(amountPaid);
        purchase.setPaymentMethod(method);
        purchase.setPaymentReference(reference);
        purchase.setCreatedAt(now);
        tierPurchaseRepository.save(purchase);
    }

    static String describe(Tier tier, BillingCycle cycle) {
        return "Subscription upgrade to " + tier.name() + " (" + cycle.name().toLowerCase(Locale.ROOT) + ")";
    }
}
