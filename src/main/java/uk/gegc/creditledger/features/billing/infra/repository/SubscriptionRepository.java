package uk.gegc.creditledger.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.creditledger.features.billing.domain.model.Subscription;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

    List<Subscription> findByCurrentTierGreaterThanAndExpiresAtBefore(int tier, LocalDateTime cutoff);
}
