package uk.gegc.creditledger.features.billing.domain.model;

import uk.gegc.creditledger.features.billing.domain.exception.InvalidCycleException;

import java.time.Duration;
import java.util.Locale;

public enum BillingCycle {
    MONTHLY(Duration.ofDays(30)),
    YEARLY(Duration.ofDays(365));

    private final Duration length;

    BillingCycle(Duration length) {
        this.length = length;
    }

    public Duration getLength() {
        return length;
    }

    public static BillingCycle fromYearlyFlag(boolean yearly) {
        return yearly ? YEARLY : MONTHLY;
    }

    /**
     * Parses {@code monthly} or {@code yearly}, case-insensitively.
     *
     * @throws InvalidCycleException for anything else
     */
    public static BillingCycle parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidCycleException("Billing cycle is required");
        }
        try {
            return BillingCycle.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidCycleException("Unsupported billing cycle: " + value);
        }
    }
}
