package uk.gegc.creditledger.features.billing.domain.exception;

public class UnknownTierException extends RuntimeException {

    private final int level;

    public UnknownTierException(int level) {
        super("Unknown subscription tier: " + level);
        this.level = level;
    }

    public int getLevel() {
        return level;
    }
}
