package uk.gegc.creditledger.features.billing.api.dto;

import uk.gegc.creditledger.features.billing.domain.model.BillingCycle;
import uk.gegc.creditledger.features.billing.domain.model.FailureReason;
import uk.gegc.creditledger.features.billing.domain.model.PaymentPurpose;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSessionStatus;

import java.time.LocalDateTime;
import java.util.UUID;

public record PaymentSessionDto(
        UUID invoiceId,
        String externalRef,
        long amount,
        String currency,
        PaymentPurpose purpose,
        PaymentSessionStatus status,
        FailureReason failureReason,
        Integer targetTier,
        BillingCycle targetCycle,
        LocalDateTime createdAt,
        LocalDateTime expiresAt,
        LocalDateTime consumedAt
) {}
