package uk.gegc.creditledger.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "CheckoutResponse", description = "Payment session opened with the gateway")
public record CheckoutResponse(
        @Schema(description = "Server-side invoice id; keep it to verify the payment on return")
        UUID invoiceId,

        @Schema(description = "Gateway reference for this payment", example = "cs_test_...")
        String externalRef,

        @Schema(description = "Gateway page the user must be redirected to")
        String redirectUrl,

        @Schema(description = "Amount to be paid in minor units", example = "5000")
        long amount,

        LocalDateTime expiresAt
) {}
