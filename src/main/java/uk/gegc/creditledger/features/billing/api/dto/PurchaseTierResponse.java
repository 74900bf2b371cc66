package uk.gegc.creditledger.features.billing.api.dto;

import java.time.LocalDateTime;

public record PurchaseTierResponse(
        String message,
        long newBalance,
        int currentTier,
        LocalDateTime expiresAt,
        UpgradeQuoteDto quote
) {}
