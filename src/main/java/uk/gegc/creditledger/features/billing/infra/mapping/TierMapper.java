package uk.gegc.creditledger.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.creditledger.features.billing.api.dto.TierDto;
import uk.gegc.creditledger.features.billing.api.dto.TierFeaturesDto;
import uk.gegc.creditledger.features.billing.api.dto.UpgradeQuoteDto;
import uk.gegc.creditledger.features.billing.domain.model.Tier;
import uk.gegc.creditledger.features.billing.domain.model.TierFeatures;
import uk.gegc.creditledger.features.billing.domain.model.UpgradeQuote;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface TierMapper {
    TierDto toDto(Tier tier);

    TierFeaturesDto toDto(TierFeatures features);

    List<TierDto> toDtos(List<Tier> tiers);

    UpgradeQuoteDto toDto(UpgradeQuote quote);
}
