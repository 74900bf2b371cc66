package uk.gegc.creditledger.features.billing.domain.exception;

import java.util.UUID;

public class SessionNotFoundException extends RuntimeException {
    public SessionNotFoundException(UUID invoiceId) {
        super("Payment session not found: " + invoiceId);
    }
}
