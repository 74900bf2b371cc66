package uk.gegc.creditledger.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.creditledger.features.billing.api.dto.PaymentSessionDto;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSession;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface PaymentSessionMapper {
    PaymentSessionDto toDto(PaymentSession entity);
}
