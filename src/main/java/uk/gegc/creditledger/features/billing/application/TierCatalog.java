package uk.gegc.creditledger.features.billing.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.creditledger.features.billing.domain.exception.UnknownTierException;
import uk.gegc.creditledger.features.billing.domain.model.BillingCycle;
import uk.gegc.creditledger.features.billing.domain.model.Tier;
import uk.gegc.creditledger.features.billing.domain.model.TierFeatures;

import java.util.Comparator;
import java.util.List;

/**
 * Static, ordered tier definitions loaded from {@code billing.tiers} at startup.
 * Levels must be contiguous from 0, level 0 must be free and every paid level must have positive prices.
 */
@Slf4j
@Component
public class TierCatalog {

    private final List<Tier> tiers;

    public TierCatalog(BillingProperties properties) {
        List<Tier> loaded = properties.getTiers().stream()
                .sorted(Comparator.comparingInt(BillingProperties.TierDefinition::getLevel))
                .map(TierCatalog::toTier)
                .toList();
        validate(loaded);
        this.tiers = loaded;
        log.info("Loaded {} subscription tiers: {}", tiers.size(),
                tiers.stream().map(Tier::name).toList());
    }

    public List<Tier> all() {
        return tiers;
    }

    public Tier get(int level) {
        if (level < 0 || level >= tiers.size()) {
            throw new UnknownTierException(level);
        }
        return tiers.get(level);
    }

    public long price(int level, BillingCycle cycle) {
        return get(level).price(cycle);
    }

    public Tier free() {
        return tiers.get(0);
    }

    public int highestLevel() {
        return tiers.size() - 1;
    }

    private static Tier toTier(BillingProperties.TierDefinition definition) {
        Integer badge = definition.getBadge();
        if (badge == null && definition.getLevel() > 0) {
            badge = definition.getLevel();
        }
        return new Tier(
                definition.getLevel(),
                definition.getName(),
                definition.getMonthlyPrice(),
                definition.getYearlyPrice(),
                new TierFeatures(
                        definition.getDailyPosts(),
                        definition.getMediaPerPost(),
                        definition.isShowsAds(),
                        badge
                )
        );
    }

    private static void validate(List<Tier> tiers) {
        if (tiers.isEmpty()) {
            throw new IllegalStateException("billing.tiers must define at least the free tier (level 0)");
        }
        for (int i = 0; i < tiers.size(); i++) {
            Tier tier = tiers.get(i);
            if (tier.level() != i) {
                throw new IllegalStateException("Tier levels must be contiguous from 0; missing level " + i);
            }
            if (tier.isFree() && (tier.monthlyPrice() != 0 || tier.yearlyPrice() != 0)) {
                throw new IllegalStateException("Tier 0 must be free");
            }
            if (!tier.isFree() && (tier.monthlyPrice() <= 0 || tier.yearlyPrice() <= 0)) {
                throw new IllegalStateException("Paid tier " + tier.level() + " must have positive prices");
            }
        }
    }
}
