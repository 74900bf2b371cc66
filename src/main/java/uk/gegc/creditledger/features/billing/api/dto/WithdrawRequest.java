package uk.gegc.creditledger.features.billing.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record WithdrawRequest(
        @NotNull(message = "amount is required")
        @Positive(message = "amount must be positive")
        Long amount,

        @Size(max = 255)
        String description
) {}
