package uk.gegc.creditledger.features.billing.domain.exception;

/**
 * Base type for failures talking to the external payment gateway.
 */
public abstract class PaymentGatewayException extends RuntimeException {

    protected PaymentGatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
