package uk.gegc.creditledger.features.billing.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging utility for billing operations.
 * Populates MDC for the duration of a single log call so ledger and session events can be queried by field.
 */
public class BillingStructuredLogger {

    private BillingStructuredLogger() {
    }

    /**
     * Log a ledger write with structured fields.
     */
    public static void logLedgerWrite(Logger logger, String level, String message,
            UUID ownerId, String kind, String source, long amount,
            String referenceId, long balanceAfter, Object... additionalArgs) {

        MDC.put("billing.userId", ownerId != null ? ownerId.toString() : null);
        MDC.put("billing.kind", kind);
        MDC.put("billing.source", source);
        MDC.put("billing.amount", String.valueOf(amount));
        MDC.put("billing.referenceId", referenceId);
        MDC.put("billing.balanceAfter", String.valueOf(balanceAfter));

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearBillingMDC();
        }
    }

    /**
     * Log a payment session state change.
     */
    public static void logSessionTransition(Logger logger, String level, String message,
            UUID invoiceId, UUID userId, String status, Object... additionalArgs) {

        MDC.put("billing.invoiceId", invoiceId != null ? invoiceId.toString() : null);
        MDC.put("billing.userId", userId != null ? userId.toString() : null);
        MDC.put("billing.sessionStatus", status);

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearBillingMDC();
        }
    }

    /**
     * Clear billing-specific MDC context.
     */
    public static void clearBillingMDC() {
        MDC.remove("billing.userId");
        MDC.remove("billing.kind");
        MDC.remove("billing.source");
        MDC.remove("billing.amount");
        MDC.remove("billing.referenceId");
        MDC.remove("billing.balanceAfter");
        MDC.remove("billing.invoiceId");
        MDC.remove("billing.sessionStatus");
    }

    private static void log(Logger logger, String level, String message, Object... args) {
        switch (level.toLowerCase()) {
            case "warn" -> logger.warn(message, args);
            case "error" -> logger.error(message, args);
            case "debug" -> logger.debug(message, args);
            default -> logger.info(message, args);
        }
    }
}
