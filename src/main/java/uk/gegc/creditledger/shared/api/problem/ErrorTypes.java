package uk.gegc.creditledger.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://docs.gegc.uk/credit-ledger/errors";

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");
    public static final URI WEBHOOK_INVALID_SIGNATURE = URI.create(BASE_URL + "/webhook-invalid-signature");

    // ==================== Ledger Errors ====================
    public static final URI INSUFFICIENT_FUNDS = URI.create(BASE_URL + "/insufficient-funds");
    public static final URI WALLET_FROZEN = URI.create(BASE_URL + "/wallet-frozen");
    public static final URI IDEMPOTENCY_CONFLICT = URI.create(BASE_URL + "/idempotency-conflict");
    public static final URI OPTIMISTIC_LOCK_CONFLICT = URI.create(BASE_URL + "/optimistic-lock-conflict");

    // ==================== Subscription Errors ====================
    public static final URI NOT_AN_UPGRADE = URI.create(BASE_URL + "/not-an-upgrade");
    public static final URI INVALID_CYCLE = URI.create(BASE_URL + "/invalid-cycle");
    public static final URI UNKNOWN_TIER = URI.create(BASE_URL + "/unknown-tier");

    // ==================== Payment Session Errors ====================
    public static final URI SESSION_NOT_FOUND = URI.create(BASE_URL + "/session-not-found");
    public static final URI SESSION_MISMATCH = URI.create(BASE_URL + "/session-mismatch");
    public static final URI SESSION_EXPIRED = URI.create(BASE_URL + "/session-expired");
    public static final URI GATEWAY_UNAVAILABLE = URI.create(BASE_URL + "/gateway-unavailable");
    public static final URI GATEWAY_ERROR = URI.create(BASE_URL + "/gateway-error");

    // ==================== Generic ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
