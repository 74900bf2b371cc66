package uk.gegc.creditledger.features.billing.domain.model;

import java.util.Locale;

/**
 * Status the gateway reported on its redirect back to us. Only a hint: verification decides.
 */
public enum GatewayStatus {
    SUCCESS,
    CANCELLED,
    FAILED,
    EXPIRED,
    OTHER;

    /**
     * Normalises the raw status string. A missing status is treated as a success claim,
     * which is then confirmed or refuted by {@code verify_payment}.
     */
    public static GatewayStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return SUCCESS;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "success", "completed", "complete", "paid" -> SUCCESS;
            case "cancelled", "canceled", "user canceled", "user cancelled" -> CANCELLED;
            case "failed", "failure" -> FAILED;
            case "expired" -> EXPIRED;
            default -> OTHER;
        };
    }

    public FailureReason toFailureReason() {
        return switch (this) {
            case CANCELLED -> FailureReason.CANCELLED;
            case FAILED -> FailureReason.FAILED;
            case EXPIRED -> FailureReason.EXPIRED;
            case SUCCESS, OTHER -> FailureReason.OTHER;
        };
    }
}
