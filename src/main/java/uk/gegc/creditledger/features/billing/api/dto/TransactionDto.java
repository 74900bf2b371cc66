package uk.gegc.creditledger.features.billing.api.dto;

import uk.gegc.creditledger.features.billing.domain.model.TransactionKind;
import uk.gegc.creditledger.features.billing.domain.model.TransactionSource;

import java.time.LocalDateTime;
import java.util.UUID;

public record TransactionDto(
        Long id,
        UUID walletId,
        TransactionKind kind,
        TransactionSource source,
        long amount,
        String description,
        String referenceId,
        long balanceAfter,
        LocalDateTime createdAt
) {}
