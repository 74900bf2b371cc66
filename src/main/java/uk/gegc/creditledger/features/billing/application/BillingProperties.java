package uk.gegc.creditledger.features.billing.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Billing configuration (ledger limits, session lifecycle, gateway retry policy, tier catalog).
 */
@Configuration
@ConfigurationProperties(prefix = "billing")
@Validated
@Data
public class BillingProperties {

    /**
     * Single currency code used for every wallet and gateway payment (e.g., usd).
     */
    @NotBlank
    private String currency = "usd";

    /**
     * Minutes a payment session stays open before the sweeper expires it.
     * Stripe Checkout accepts between 30 minutes and 24 hours.
     */
    @Min(30)
    @Max(1440)
    private int sessionTtlMinutes = 60;

    /**
     * Smallest wallet top-up, in minor units.
     */
    @Positive
    private long minTopUp = 100L;

    /**
     * Largest wallet top-up, in minor units.
     */
    @Positive
    private long maxTopUp = 10_000_000L;

    @Positive
    private int historyPageSize = 20;

    @Positive
    private int maxHistoryPageSize = 100;

    /**
     * Delay between payment session expiry sweeps.
     */
    @Positive
    private long sessionSweeperMs = 60_000L;

    /**
     * Delay between subscription expiry sweeps.
     */
    @Positive
    private long subscriptionSweeperMs = 300_000L;

    /**
     * How long a lapsed subscription keeps its tier before reverting to the free tier.
     */
    @NotNull
    private Duration subscriptionGracePeriod = Duration.ZERO;

    @Valid
    private Gateway gateway = new Gateway();

    /**
     * Tier catalog, ordered by level starting at 0 (free).
     */
    @Valid
    private List<TierDefinition> tiers = new ArrayList<>();

    @Data
    public static class Gateway {
        /**
         * Payment method name accepted on top-up requests.
         */
        @NotBlank
        private String provider = "stripe";

        /**
         * Attempts per gateway call, including the first one.
         */
        @Min(1)
        @Max(10)
        private int maxAttempts = 3;

        /**
         * Base backoff between attempts; doubles after each failure.
         */
        @PositiveOrZero
        private long backoffMs = 200L;
    }

    @Data
    public static class TierDefinition {
        @PositiveOrZero
        private int level;
        @NotBlank
        private String name;
        @PositiveOrZero
        private long monthlyPrice;
        @PositiveOrZero
        private long yearlyPrice;
        @PositiveOrZero
        private int dailyPosts;
        @PositiveOrZero
        private int mediaPerPost;
        private boolean showsAds;
        private Integer badge;
    }
}
