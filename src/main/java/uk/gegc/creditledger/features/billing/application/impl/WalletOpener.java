package uk.gegc.creditledger.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creditledger.features.billing.domain.model.Wallet;
import uk.gegc.creditledger.features.billing.infra.repository.WalletRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Inserts an empty wallet in its own transaction, so a duplicate-key race on first use
 * rolls back only the insert and not the caller's ledger write.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WalletOpener {

    private final WalletRepository walletRepository;
    private final Clock clock;

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException if another transaction opened it first
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void open(UUID ownerId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Wallet wallet = new Wallet();
        wallet.setOwnerId(ownerId);
        wallet.setBalance(0L);
        wallet.setTotalEarned(0L);
        wallet.setTotalSpent(0L);
        wallet.setFrozen(false);
        wallet.setCreatedAt(now);
        wallet.setUpdatedAt(now);
        walletRepository.saveAndFlush(wallet);
        log.info("Opened wallet for user {}", ownerId);
    }
}
