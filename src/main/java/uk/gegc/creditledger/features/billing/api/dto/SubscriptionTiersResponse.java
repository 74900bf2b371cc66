package uk.gegc.creditledger.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.creditledger.features.billing.domain.model.BillingCycle;

import java.time.LocalDateTime;
import java.util.List;

@Schema(name = "SubscriptionTiersResponse", description = "Tier catalog with the caller's subscription and balance")
public record SubscriptionTiersResponse(
        List<TierDto> tiers,

        @Schema(description = "Effective tier level; 0 once a subscription has lapsed", example = "1")
        int currentTier,

        BillingCycle billingCycle,

        @Schema(description = "Wallet balance in minor units", example = "15000")
        long balance,

        LocalDateTime expiresAt
) {}
