package uk.gegc.creditledger.features.billing.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

@Schema(name = "PurchaseTierRequest", description = "Request to upgrade the subscription tier")
public record PurchaseTierRequest(
        @Schema(example = "2", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "target_tier is required")
        @Min(value = 1, message = "target_tier must be a paid tier")
        Integer targetTier,

        @Schema(description = "Yearly instead of monthly billing", example = "false")
        @JsonProperty("is_yearly")
        boolean isYearly
) {}
