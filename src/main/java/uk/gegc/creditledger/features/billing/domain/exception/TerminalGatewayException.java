package uk.gegc.creditledger.features.billing.domain.exception;

/**
 * The gateway rejected the request outright. Retrying cannot succeed; the session fails.
 */
public class TerminalGatewayException extends PaymentGatewayException {

    public TerminalGatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
