package uk.gegc.creditledger.features.billing.application;

import uk.gegc.creditledger.features.billing.api.dto.TransactionDto;
import uk.gegc.creditledger.features.billing.api.dto.TransactionPageDto;
import uk.gegc.creditledger.features.billing.api.dto.WalletDto;
import uk.gegc.creditledger.features.billing.domain.model.TransactionSource;

import java.util.UUID;

/**
 * The wallet ledger: the only component allowed to move a balance.
 * Every write updates the wallet and appends its transaction in one database transaction,
 * holding the wallet row lock for the duration.
 */
public interface WalletLedgerService {

    /**
     * Increases balance and total earned, appending a {@code CREDIT} row.
     * Frozen wallets accept only {@link TransactionSource#ADJUSTMENT} credits.
     *
     * @param idempotencyKey optional; a replayed key returns the original transaction unchanged
     * @throws uk.gegc.creditledger.features.billing.domain.exception.WalletFrozenException for purchase credits on a frozen wallet
     * @throws uk.gegc.creditledger.features.billing.domain.exception.IdempotencyConflictException if the key belongs to a different write
     */
    TransactionDto credit(UUID ownerId, long amount, TransactionSource source,
                          String description, String referenceId, String idempotencyKey);

    /**
     * Decreases balance and increases total spent, appending a {@code DEBIT} row.
     *
     * @throws uk.gegc.creditledger.features.billing.domain.exception.InsufficientFundsException if amount exceeds the balance
     * @throws uk.gegc.creditledger.features.billing.domain.exception.WalletFrozenException if the wallet is frozen
     */
    TransactionDto debit(UUID ownerId, long amount, TransactionSource source,
                         String description, String referenceId, String idempotencyKey);

    long getBalance(UUID ownerId);

    WalletDto getWallet(UUID ownerId);

    /**
     * Reverse-chronological history.
     *
     * @param page 1-based page number
     */
    TransactionPageDto getHistory(UUID ownerId, int page, int size);

    WalletDto freeze(UUID ownerId, String reason);

    WalletDto unfreeze(UUID ownerId);

    /**
     * Fails fast before a purchase is started for a wallet that could not receive its credit.
     */
    void requireNotFrozen(UUID ownerId);
}
