package uk.gegc.creditledger.features.billing.infra.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.creditledger.features.billing.domain.model.WalletTransaction;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WalletTransactionRepository extends JpaRepository<WalletTransaction, Long> {

    Page<WalletTransaction> findByWalletIdOrderByCreatedAtDescIdDesc(UUID walletId, Pageable pageable);

    List<WalletTransaction> findByWalletIdOrderByCreatedAtAscIdAsc(UUID walletId);

    Optional<WalletTransaction> findByIdempotencyKey(String idempotencyKey);

    long countByWalletId(UUID walletId);

    long countByReferenceId(String referenceId);
}
