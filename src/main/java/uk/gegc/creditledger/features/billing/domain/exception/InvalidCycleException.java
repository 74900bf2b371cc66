package uk.gegc.creditledger.features.billing.domain.exception;

public class InvalidCycleException extends RuntimeException {
    public InvalidCycleException(String message) {
        super(message);
    }
}
