package uk.gegc.creditledger.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "TransactionPageDto", description = "One page of wallet transactions, newest first")
public record TransactionPageDto(
        List<TransactionDto> transactions,

        @Schema(description = "1-based page number", example = "1")
        int page,

        @Schema(example = "20")
        int pageSize,

        long totalCount,

        boolean hasNext
) {}
