package uk.gegc.creditledger.features.billing.domain.exception;

/**
 * A callback did not match any stored session: unknown invoice, wrong external reference or wrong owner.
 * The message never says which, so it does not reveal whether another user's session exists.
 */
public class SessionMismatchException extends RuntimeException {
    public SessionMismatchException(String message) {
        super(message);
    }
}
