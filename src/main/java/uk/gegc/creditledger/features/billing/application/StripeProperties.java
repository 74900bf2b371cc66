package uk.gegc.creditledger.features.billing.application;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Stripe configuration properties: keys and redirect URLs.
 */
@Configuration
@ConfigurationProperties(prefix = "stripe")
@Data
public class StripeProperties {
    /** Secret API key (server-side). */
    private String secretKey;

    /** Webhook signing secret for signature verification. */
    private String webhookSecret;

    /**
     * Where Stripe sends the user after paying. {@code {INVOICE_ID}} is replaced with the invoice id
     * and the Checkout session id is appended so the client can call the verify endpoint.
     */
    private String successUrl;

    /** Where Stripe sends the user after abandoning checkout; supports {@code {INVOICE_ID}} too. */
    private String cancelUrl;
}
