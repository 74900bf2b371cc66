package uk.gegc.creditledger.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.creditledger.features.billing.api.dto.TransactionDto;
import uk.gegc.creditledger.features.billing.api.dto.WalletDto;
import uk.gegc.creditledger.features.billing.domain.model.Wallet;
import uk.gegc.creditledger.features.billing.domain.model.WalletTransaction;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface WalletMapper {
    WalletDto toDto(Wallet entity);

    TransactionDto toDto(WalletTransaction entity);

    List<TransactionDto> toTransactionDtos(List<WalletTransaction> entities);
}
