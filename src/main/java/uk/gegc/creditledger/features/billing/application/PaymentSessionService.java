package uk.gegc.creditledger.features.billing.application;

import uk.gegc.creditledger.features.billing.api.dto.CheckoutResponse;
import uk.gegc.creditledger.features.billing.api.dto.PaymentSessionDto;

import java.util.UUID;

/**
 * Opens payment sessions with the gateway and exposes their state.
 * Session creation never runs inside a database transaction: the gateway is called first and the
 * session is persisted only once it returned an external reference.
 */
public interface PaymentSessionService {

    CheckoutResponse createTopUpSession(UUID userId, long amount, String paymentMethod);

    /**
     * Opens a session for the current upgrade quote. The quote is frozen on the session and honoured
     * on reconciliation even if proration would have changed by then.
     */
    CheckoutResponse createTierUpgradeSession(UUID userId, int targetTier, boolean yearly);

    /**
     * @throws uk.gegc.creditledger.features.billing.domain.exception.SessionNotFoundException
     *         if the session does not exist or belongs to another user
     */
    PaymentSessionDto getSession(UUID userId, UUID invoiceId);

    PaymentSessionDto getSessionForAdmin(UUID invoiceId);

    /**
     * Moves pending and verifying sessions past their expiry to expired.
     *
     * @return number of sessions expired
     */
    int expireStaleSessions();
}
