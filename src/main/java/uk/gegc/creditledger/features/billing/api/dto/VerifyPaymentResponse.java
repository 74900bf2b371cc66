package uk.gegc.creditledger.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.creditledger.features.billing.domain.model.FailureReason;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSessionStatus;

import java.util.UUID;

@Schema(name = "VerifyPaymentResponse", description = "Outcome of reconciling a gateway callback")
public record VerifyPaymentResponse(
        boolean success,
        String message,
        UUID invoiceId,
        PaymentSessionStatus status,
        FailureReason failureReason,

        @Schema(description = "True when this callback repeated one that was already applied")
        boolean alreadyProcessed,

        @Schema(description = "Wallet balance after the credit, when one was applied")
        Long newBalance
) {}
