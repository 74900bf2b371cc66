package uk.gegc.creditledger.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "WalletDto", description = "User's wallet")
public record WalletDto(
        @Schema(description = "Owner UUID")
        UUID ownerId,

        @Schema(description = "Current balance in minor units", example = "15000")
        long balance,

        @Schema(description = "Sum of all credits", example = "20000")
        long totalEarned,

        @Schema(description = "Sum of all debits", example = "5000")
        long totalSpent,

        @Schema(description = "Whether debits and purchase credits are blocked")
        boolean frozen,

        @Schema(description = "Last balance update timestamp")
        LocalDateTime updatedAt
) {}
