package uk.gegc.creditledger.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@Schema(name = "AddFundsRequest", description = "Request to top up the wallet through the payment gateway")
public record AddFundsRequest(
        @Schema(description = "Amount in minor units", example = "5000", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "amount is required")
        @Positive(message = "amount must be positive")
        Long amount,

        @Schema(description = "Payment method", example = "stripe", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "payment_method is required")
        String paymentMethod
) {}
