package uk.gegc.creditledger.features.billing.domain.exception;

/**
 * Thrown when a debit exceeds the wallet balance. The wallet and the ledger are left untouched.
 */
public class InsufficientFundsException extends RuntimeException {

    private final long requestedAmount;
    private final long availableBalance;
    private final long shortfall;

    public InsufficientFundsException(String message, long requestedAmount, long availableBalance, long shortfall) {
        super(message);
        this.requestedAmount = requestedAmount;
        this.availableBalance = availableBalance;
        this.shortfall = shortfall;
    }

    public long getRequestedAmount() {
        return requestedAmount;
    }

    public long getAvailableBalance() {
        return availableBalance;
    }

    public long getShortfall() {
        return shortfall;
    }
}
