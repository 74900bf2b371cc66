package uk.gegc.creditledger.features.billing.application;

public interface StripeWebhookService {

    enum Result { OK, DUPLICATE, IGNORED }

    /**
     * Verifies the Stripe signature and feeds Checkout session events into reconciliation.
     */
    Result process(String payload, String signatureHeader);
}
