package uk.gegc.creditledger.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.creditledger.features.billing.domain.model.TierPurchase;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TierPurchaseRepository extends JpaRepository<TierPurchase, UUID> {

    List<TierPurchase> findByUserIdOrderByCreatedAtDesc(UUID userId);

    Optional<TierPurchase> findByPaymentReference(String paymentReference);
}
