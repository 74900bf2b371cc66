package uk.gegc.creditledger.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.creditledger.features.billing.domain.model.BillingCycle;

@Schema(name = "UpgradeQuoteDto", description = "Price of moving to a higher tier, in minor units")
public record UpgradeQuoteDto(
        int fromTier,
        int toTier,
        BillingCycle targetCycle,
        @Schema(example = "1999")
        long totalCost,
        @Schema(description = "Unused value of the current cycle", example = "500")
        long creditApplied,
        @Schema(example = "1499")
        long amountToPay
) {}
