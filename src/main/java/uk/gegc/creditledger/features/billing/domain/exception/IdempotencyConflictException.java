package uk.gegc.creditledger.features.billing.domain.exception;

/**
 * An idempotency key was replayed for a different ledger write.
 */
public class IdempotencyConflictException extends RuntimeException {
    public IdempotencyConflictException(String message) {
        super(message);
    }
}
