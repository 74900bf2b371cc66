package uk.gegc.creditledger.features.billing.domain.exception;

public class NotAnUpgradeException extends RuntimeException {

    private final int currentTier;
    private final int targetTier;

    public NotAnUpgradeException(int currentTier, int targetTier) {
        super("Tier " + targetTier + " is not an upgrade from tier " + currentTier);
        this.currentTier = currentTier;
        this.targetTier = targetTier;
    }

    public int getCurrentTier() {
        return currentTier;
    }

    public int getTargetTier() {
        return targetTier;
    }
}
