package uk.gegc.creditledger.features.billing.domain.exception;

/**
 * Transient gateway failure (network, rate limit, 5xx). Safe to retry; nothing was committed.
 */
public class RecoverableGatewayException extends PaymentGatewayException {

    public RecoverableGatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
