package uk.gegc.creditledger.features.billing.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.creditledger.features.billing.domain.exception.InvalidCycleException;
import uk.gegc.creditledger.features.billing.domain.exception.NotAnUpgradeException;
import uk.gegc.creditledger.features.billing.domain.model.BillingCycle;
import uk.gegc.creditledger.features.billing.domain.model.UpgradeQuote;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * The one place tier upgrades are priced. Proration credits the unused share of the current
 * cycle at the current cycle's price, rounded half-up to a whole minor unit.
 */
@Component
@RequiredArgsConstructor
public class UpgradePricingCalculator {

    private final TierCatalog tierCatalog;

    public UpgradeQuote computeUpgrade(int currentTier,
                                       BillingCycle currentCycle,
                                       LocalDateTime currentExpiresAt,
                                       int targetTier,
                                       BillingCycle targetCycle,
                                       LocalDateTime now) {
        if (targetCycle == null) {
            throw new InvalidCycleException("Target billing cycle is required");
        }
        if (targetTier <= currentTier) {
            throw new NotAnUpgradeException(currentTier, targetTier);
        }

        long totalCost = tierCatalog.price(targetTier, targetCycle);

        long creditApplied = 0L;
        if (currentTier > 0 && currentExpiresAt != null && now.isBefore(currentExpiresAt)) {
            if (currentCycle == null) {
                throw new InvalidCycleException("Current subscription has no billing cycle");
            }
            long currentPrice = tierCatalog.price(currentTier, currentCycle);
            long unused = proratedCredit(currentPrice, Duration.between(now, currentExpiresAt), currentCycle.getLength());
            creditApplied = Math.min(totalCost, unused);
        }

        return new UpgradeQuote(currentTier, targetTier, targetCycle, totalCost, creditApplied, totalCost - creditApplied);
    }

    static long proratedCredit(long price, Duration remaining, Duration cycleLength) {
        return BigDecimal.valueOf(price)
                .multiply(BigDecimal.valueOf(remaining.toMillis()))
                .divide(BigDecimal.valueOf(cycleLength.toMillis()), 0, RoundingMode.HALF_UP)
                .longValueExact();
    }
}
