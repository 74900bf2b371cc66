package uk.gegc.creditledger.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import uk.gegc.creditledger.features.billing.api.dto.TransactionDto;
import uk.gegc.creditledger.features.billing.api.dto.TransactionPageDto;
import uk.gegc.creditledger.features.billing.api.dto.WalletDto;
import uk.gegc.creditledger.features.billing.application.BillingMetricsService;
import uk.gegc.creditledger.features.billing.application.BillingProperties;
import uk.gegc.creditledger.features.billing.application.BillingStructuredLogger;
import uk.gegc.creditledger.features.billing.application.WalletLedgerService;
import uk.gegc.creditledger.features.billing.domain.exception.IdempotencyConflictException;
import uk.gegc.creditledger.features.billing.domain.exception.InsufficientFundsException;
import uk.gegc.creditledger.features.billing.domain.exception.WalletFrozenException;
import uk.gegc.creditledger.features.billing.domain.model.TransactionKind;
import uk.gegc.creditledger.features.billing.domain.model.TransactionSource;
import uk.gegc.creditledger.features.billing.domain.model.Wallet;
import uk.gegc.creditledger.features.billing.domain.model.WalletTransaction;
import uk.gegc.creditledger.features.billing.infra.mapping.WalletMapper;
import uk.gegc.creditledger.features.billing.infra.repository.WalletRepository;
import uk.gegc.creditledger.features.billing.infra.repository.WalletTransactionRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class WalletLedgerServiceImpl implements WalletLedgerService {

    private final WalletRepository walletRepository;
    private final WalletOpener walletOpener;
    private final WalletTransactionRepository transactionRepository;
    private final WalletMapper walletMapper;
    private final BillingMetricsService metricsService;
    private final BillingProperties billingProperties;
    private final Clock clock;

    @Override
    @Transactional
    public TransactionDto credit(UUID ownerId, long amount, TransactionSource source,
                                 String description, String referenceId, String idempotencyKey) {
        validateWrite(ownerId, amount, source, description);

        Wallet wallet = lockOrOpen(ownerId);

        Optional<TransactionDto> replay = findReplay(idempotencyKey, ownerId, TransactionKind.CREDIT, amount);
        if (replay.isPresent()) {
            return replay.get();
        }

        if (wallet.isFrozen() && source != TransactionSource.ADJUSTMENT) {
            log.warn("Rejected {} credit of {} for frozen wallet {}", source, amount, ownerId);
            throw new WalletFrozenException(ownerId);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        wallet.setBalance(Math.addExact(wallet.getBalance(), amount));
        wallet.setTotalEarned(Math.addExact(wallet.getTotalEarned(), amount));
        wallet.setUpdatedAt(now);

        WalletTransaction tx = append(wallet, TransactionKind.CREDIT, source, amount,
                description, referenceId, idempotencyKey, now);

        metricsService.recordCredit(ownerId, amount, source);
        BillingStructuredLogger.logLedgerWrite(log, "info",
                "Credited {} to wallet {} ({}), balance now {}",
                ownerId, TransactionKind.CREDIT.name(), source.name(), amount, referenceId, tx.getBalanceAfter(),
                amount, ownerId, source, tx.getBalanceAfter());

        return walletMapper.toDto(tx);
    }

    @Override
    @Transactional
    public TransactionDto debit(UUID ownerId, long amount, TransactionSource source,
                                String description, String referenceId, String idempotencyKey) {
        validateWrite(ownerId, amount, source, description);

        Wallet wallet = walletRepository.findByOwnerIdForUpdate(ownerId).orElse(null);
        if (wallet == null) {
            metricsService.recordDebitRejected(ownerId, "insufficient_funds");
            throw new InsufficientFundsException(
                    "Insufficient balance: requested " + amount + ", available 0", amount, 0L, amount);
        }

        Optional<TransactionDto> replay = findReplay(idempotencyKey, ownerId, TransactionKind.DEBIT, amount);
        if (replay.isPresent()) {
            return replay.get();
        }

        if (wallet.isFrozen()) {
            metricsService.recordDebitRejected(ownerId, "wallet_frozen");
            throw new WalletFrozenException(ownerId);
        }

        long balance = wallet.getBalance();
        if (amount > balance) {
            metricsService.recordDebitRejected(ownerId, "insufficient_funds");
            throw new InsufficientFundsException(
                    "Insufficient balance: requested " + amount + ", available " + balance,
                    amount, balance, amount - balance);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        wallet.setBalance(balance - amount);
        wallet.setTotalSpent(Math.addExact(wallet.getTotalSpent(), amount));
        wallet.setUpdatedAt(now);

        WalletTransaction tx = append(wallet, TransactionKind.DEBIT, source, amount,
                description, referenceId, idempotencyKey, now);

        metricsService.recordDebit(ownerId, amount, source);
        BillingStructuredLogger.logLedgerWrite(log, "info",
                "Debited {} from wallet {} ({}), balance now {}",
                ownerId, TransactionKind.DEBIT.name(), source.name(), amount, referenceId, tx.getBalanceAfter(),
                amount, ownerId, source, tx.getBalanceAfter());

        return walletMapper.toDto(tx);
    }

    @Override
    @Transactional(readOnly = true)
    public long getBalance(UUID ownerId) {
        return walletRepository.findById(ownerId)
                .map(Wallet::getBalance)
                .orElse(0L);
    }

    @Override
    @Transactional(readOnly = true)
    public WalletDto getWallet(UUID ownerId) {
        return walletRepository.findById(ownerId)
                .map(walletMapper::toDto)
                .orElseGet(() -> new WalletDto(ownerId, 0L, 0L, 0L, false, null));
    }

    @Override
    @Transactional(readOnly = true)
    public TransactionPageDto getHistory(UUID ownerId, int page, int size) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1");
        }
        int pageSize = size <= 0
                ? billingProperties.getHistoryPageSize()
                : Math.min(size, billingProperties.getMaxHistoryPageSize());

        Page<WalletTransaction> result = transactionRepository
                .findByWalletIdOrderByCreatedAtDescIdDesc(ownerId, PageRequest.of(page - 1, pageSize));

        return new TransactionPageDto(
                walletMapper.toTransactionDtos(result.getContent()),
                page,
                pageSize,
                result.getTotalElements(),
                result.hasNext()
        );
    }

    @Override
    @Transactional
    public WalletDto freeze(UUID ownerId, String reason) {
        Wallet wallet = lockOrOpen(ownerId);
        wallet.setFrozen(true);
        wallet.setFrozenReason(reason);
        wallet.setUpdatedAt(LocalDateTime.now(clock));
        log.warn("Wallet {} frozen: {}", ownerId, reason);
        return walletMapper.toDto(wallet);
    }

    @Override
    @Transactional
    public WalletDto unfreeze(UUID ownerId) {
        Wallet wallet = lockOrOpen(ownerId);
        wallet.setFrozen(false);
        wallet.setFrozenReason(null);
        wallet.setUpdatedAt(LocalDateTime.now(clock));
        log.info("Wallet {} unfrozen", ownerId);
        return walletMapper.toDto(wallet);
    }

    @Override
    @Transactional(readOnly = true)
    public void requireNotFrozen(UUID ownerId) {
        boolean frozen = walletRepository.findById(ownerId)
                .map(Wallet::isFrozen)
                .orElse(false);
        if (frozen) {
            throw new WalletFrozenException(ownerId);
        }
    }

    private void validateWrite(UUID ownerId, long amount, TransactionSource source, String description) {
        if (ownerId == null) {
            throw new IllegalArgumentException("ownerId is required");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        if (source == null) {
            throw new IllegalArgumentException("Transaction source is required");
        }
        if (!StringUtils.hasText(description)) {
            throw new IllegalArgumentException("Transaction description is required");
        }
    }

    /**
     * Plain existence check first: a locking read of a missing row would gap-lock the insert in {@link WalletOpener}.
     */
    private Wallet lockOrOpen(UUID ownerId) {
        if (!walletRepository.existsById(ownerId)) {
            try {
                walletOpener.open(ownerId);
            } catch (DataIntegrityViolationException e) {
                log.debug("Wallet for user {} was opened concurrently: {}", ownerId, e.getMessage());
            }
        }
        return walletRepository.findByOwnerIdForUpdate(ownerId)
                .orElseThrow(() -> new IllegalStateException("Wallet missing after opening: " + ownerId));
    }

    private Optional<TransactionDto> findReplay(String idempotencyKey, UUID ownerId, TransactionKind kind, long amount) {
        if (!StringUtils.hasText(idempotencyKey)) {
            return Optional.empty();
        }
        return transactionRepository.findByIdempotencyKey(idempotencyKey)
                .map(existing -> {
                    if (!existing.getWalletId().equals(ownerId)
                            || existing.getKind() != kind
                            || existing.getAmount() != amount) {
                        throw new IdempotencyConflictException(
                                "Idempotency key " + idempotencyKey + " was already used for a different ledger write");
                    }
                    log.info("Idempotent replay of {} {} for wallet {} (key={})", kind, amount, ownerId, idempotencyKey);
                    return walletMapper.toDto(existing);
                });
    }

    private WalletTransaction append(Wallet wallet, TransactionKind kind, TransactionSource source, long amount,
                                     String description, String referenceId, String idempotencyKey,
                                     LocalDateTime now) {
        WalletTransaction tx = new WalletTransaction();
        tx.setWalletId(wallet.getOwnerId());
        tx.setKind(kind);
        tx.setSource(source);
        tx.setAmount(amount);
        tx.setDescription(description);
        tx.setReferenceId(referenceId);
        tx.setIdempotencyKey(StringUtils.hasText(idempotencyKey) ? idempotencyKey : null);
        tx.setBalanceAfter(wallet.getBalance());
        tx.setCreatedAt(now);
        return transactionRepository.save(tx);
    }
}
