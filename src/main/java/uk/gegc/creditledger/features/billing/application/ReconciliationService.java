package uk.gegc.creditledger.features.billing.application;

import uk.gegc.creditledger.features.billing.api.dto.VerifyPaymentResponse;

import java.util.UUID;

/**
 * Turns gateway callbacks into at most one ledger credit per payment session.
 * Safe to call any number of times with the same invoice.
 */
public interface ReconciliationService {

    /**
     * @param requestingUserId the authenticated caller, or null for trusted server-to-server callbacks (webhooks)
     * @throws uk.gegc.creditledger.features.billing.domain.exception.SessionMismatchException unknown invoice,
     *         wrong external reference or foreign session
     * @throws uk.gegc.creditledger.features.billing.domain.exception.SessionExpiredException session expired
     * @throws uk.gegc.creditledger.features.billing.domain.exception.GatewayUnavailableException verification
     *         could not reach the gateway; the session stays verifying and the call can be repeated
     */
    VerifyPaymentResponse reconcile(PaymentCallback callback, UUID requestingUserId);

    record PaymentCallback(UUID invoiceId, String externalRef, String gatewayStatus) {}
}
