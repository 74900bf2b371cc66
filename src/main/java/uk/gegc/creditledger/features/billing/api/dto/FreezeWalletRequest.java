package uk.gegc.creditledger.features.billing.api.dto;

import jakarta.validation.constraints.Size;

public record FreezeWalletRequest(
        @Size(max = 255)
        String reason
) {}
