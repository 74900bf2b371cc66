package uk.gegc.creditledger.features.billing.domain.exception;

public class WebhookInvalidSignatureException extends RuntimeException {
    public WebhookInvalidSignatureException(String message) {
        super(message);
    }
}
