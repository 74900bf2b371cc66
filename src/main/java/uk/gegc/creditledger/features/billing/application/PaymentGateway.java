package uk.gegc.creditledger.features.billing.application;

import java.time.Instant;
import java.util.UUID;

/**
 * Outbound contract with the external payment gateway. Implementations translate transport failures into
 * {@link uk.gegc.creditledger.features.billing.domain.exception.RecoverableGatewayException} or
 * {@link uk.gegc.creditledger.features.billing.domain.exception.TerminalGatewayException}.
 */
public interface PaymentGateway {

    /**
     * Opens a hosted payment for the invoice.
     */
    GatewayCheckout createPayment(PaymentRequest request);

    /**
     * Asks the gateway whether the payment behind {@code externalRef} was captured for this invoice.
     */
    GatewayVerification verifyPayment(UUID invoiceId, String externalRef);

    record PaymentRequest(UUID invoiceId, long amount, String currency, String description, Instant expiresAt) {}

    record GatewayCheckout(String externalRef, String redirectUrl) {}

    /**
     * @param pending the gateway accepted the payment but has not settled it yet; neither success nor failure
     */
    record GatewayVerification(boolean success, boolean pending, long amount, String message) {

        public GatewayVerification(boolean success, long amount, String message) {
            this(success, false, amount, message);
        }

        public static GatewayVerification awaitingSettlement(long amount, String message) {
            return new GatewayVerification(false, true, amount, message);
        }
    }
}
