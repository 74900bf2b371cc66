package uk.gegc.creditledger.features.billing.domain.exception;

import java.util.UUID;

public class WalletFrozenException extends RuntimeException {

    private final UUID ownerId;

    public WalletFrozenException(UUID ownerId) {
        super("Wallet " + ownerId + " is frozen");
        this.ownerId = ownerId;
    }

    public UUID getOwnerId() {
        return ownerId;
    }
}
