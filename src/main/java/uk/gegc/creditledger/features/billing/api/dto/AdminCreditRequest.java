package uk.gegc.creditledger.features.billing.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record AdminCreditRequest(
        @NotNull @Positive
        Long amount,

        @NotBlank @Size(max = 255)
        String description,

        @Size(max = 255)
        String referenceId,

        @Size(max = 255)
        String idempotencyKey
) {}
