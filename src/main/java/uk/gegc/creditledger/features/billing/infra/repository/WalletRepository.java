package uk.gegc.creditledger.features.billing.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.creditledger.features.billing.domain.model.Wallet;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WalletRepository extends JpaRepository<Wallet, UUID> {

    /**
     * Loads the wallet with a row-level write lock held until the surrounding transaction ends.
     * Every balance mutation goes through this so writers on one wallet are serialized.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Wallet w WHERE w.ownerId = :ownerId")
    Optional<Wallet> findByOwnerIdForUpdate(@Param("ownerId") UUID ownerId);

    @Query("SELECT w.ownerId FROM Wallet w")
    List<UUID> findAllOwnerIds();
}
