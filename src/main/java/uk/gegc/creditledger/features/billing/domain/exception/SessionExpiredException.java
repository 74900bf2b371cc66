package uk.gegc.creditledger.features.billing.domain.exception;

import java.util.UUID;

public class SessionExpiredException extends RuntimeException {

    private final UUID invoiceId;

    public SessionExpiredException(UUID invoiceId) {
        super("Payment session " + invoiceId + " has expired; start a new payment");
        this.invoiceId = invoiceId;
    }

    public UUID getInvoiceId() {
        return invoiceId;
    }
}
