package uk.gegc.creditledger.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "TierDto", description = "Subscription tier with prices in minor units")
public record TierDto(
        @Schema(example = "1")
        int level,
        @Schema(example = "Bronze")
        String name,
        @Schema(example = "1000")
        long monthlyPrice,
        @Schema(example = "10000")
        long yearlyPrice,
        TierFeaturesDto features
) {}
