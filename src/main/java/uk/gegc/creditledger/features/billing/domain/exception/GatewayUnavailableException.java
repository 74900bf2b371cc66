package uk.gegc.creditledger.features.billing.domain.exception;

/**
 * Recoverable gateway failures persisted through every retry attempt.
 * The caller may try again later; session state is unchanged.
 */
public class GatewayUnavailableException extends RuntimeException {
    public GatewayUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
