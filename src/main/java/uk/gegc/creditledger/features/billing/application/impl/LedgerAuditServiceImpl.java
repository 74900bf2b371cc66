package uk.gegc.creditledger.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creditledger.features.billing.application.BillingMetricsService;
import uk.gegc.creditledger.features.billing.application.LedgerAuditService;
import uk.gegc.creditledger.features.billing.domain.model.Wallet;
import uk.gegc.creditledger.features.billing.domain.model.WalletTransaction;
import uk.gegc.creditledger.features.billing.infra.repository.WalletRepository;
import uk.gegc.creditledger.features.billing.infra.repository.WalletTransactionRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Weekly ledger audit. Replays transactions oldest first and checks every {@code balance_after}
 * snapshot, the final balance and {@code balance == total_earned - total_spent}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerAuditServiceImpl implements LedgerAuditService {

    private final WalletRepository walletRepository;
    private final WalletTransactionRepository transactionRepository;
    private final BillingMetricsService metricsService;

    @Override
    @Transactional(readOnly = true)
    public AuditResult auditWallet(UUID ownerId) {
        try {
            var walletOpt = walletRepository.findById(ownerId);
            if (walletOpt.isEmpty()) {
                return new AuditResult(ownerId, true, 0, 0, 0, 0, 0, "No wallet found for user");
            }
            Wallet wallet = walletOpt.get();

            List<WalletTransaction> transactions = transactionRepository.findByWalletIdOrderByCreatedAtAscIdAsc(ownerId);

            long running = 0;
            long earned = 0;
            long spent = 0;
            int mismatchedRows = 0;
            for (WalletTransaction tx : transactions) {
                switch (tx.getKind()) {
                    case CREDIT -> {
                        running += tx.getAmount();
                        earned += tx.getAmount();
                    }
                    case DEBIT -> {
                        running -= tx.getAmount();
                        spent += tx.getAmount();
                    }
                }
                if (running != tx.getBalanceAfter()) {
                    mismatchedRows++;
                    log.warn("Ledger row {} of wallet {} records balance_after={} but replay gives {}",
                            tx.getId(), ownerId, tx.getBalanceAfter(), running);
                }
            }

            long actual = wallet.getBalance();
            long drift = running - actual;
            boolean totalsMatch = earned == wallet.getTotalEarned()
                    && spent == wallet.getTotalSpent()
                    && actual == wallet.getTotalEarned() - wallet.getTotalSpent();
            boolean consistent = drift == 0 && mismatchedRows == 0 && totalsMatch;

            String details = String.format(
                    "Replayed: %d, Actual: %d (earned: %d/%d, spent: %d/%d), Drift: %d, Mismatched rows: %d",
                    running, actual, earned, wallet.getTotalEarned(), spent, wallet.getTotalSpent(),
                    drift, mismatchedRows);

            if (consistent) {
                metricsService.recordAuditSuccess(ownerId);
            } else {
                metricsService.recordAuditDrift(ownerId, drift);
                log.error("Ledger drift detected for wallet {}: {}", ownerId, details);
            }

            return new AuditResult(ownerId, consistent, running, actual, drift,
                    transactions.size(), mismatchedRows, details);

        } catch (RuntimeException e) {
            log.error("Error auditing wallet {}: {}", ownerId, e.getMessage(), e);
            metricsService.recordAuditFailure(ownerId, e.getMessage());
            return new AuditResult(ownerId, false, 0, 0, 0, 0, 0, "Error during audit: " + e.getMessage());
        }
    }

    @Override
    @Transactional(readOnly = true)
    public AuditSummary auditAllWallets() {
        log.info("Starting ledger audit for all wallets");

        List<AuditResult> driftResults = new ArrayList<>();
        List<UUID> ownerIds = walletRepository.findAllOwnerIds();

        for (UUID ownerId : ownerIds) {
            AuditResult result = auditWallet(ownerId);
            if (result.hasDrift()) {
                driftResults.add(result);
            }
        }

        int total = ownerIds.size();
        long totalDrift = driftResults.stream()
                .mapToLong(AuditResult::drift)
                .sum();

        AuditSummary summary = new AuditSummary(
                total, total - driftResults.size(), driftResults.size(), totalDrift, driftResults);

        log.info("Ledger audit completed: {} wallets, {} consistent, {} with drift, total drift: {}",
                total, summary.consistentWallets(), summary.walletsWithDrift(), totalDrift);
        return summary;
    }

    /**
     * Runs every Sunday at 2 AM.
     */
    @Scheduled(cron = "0 0 2 * * SUN")
    public void performWeeklyAudit() {
        log.info("Starting weekly ledger audit job");
        try {
            AuditSummary summary = auditAllWallets();
            if (summary.isSuccessful()) {
                log.info("Weekly ledger audit completed successfully: {} wallets consistent",
                        summary.consistentWallets());
            } else {
                log.error("Weekly ledger audit found drift in {} wallets, total drift: {}",
                        summary.walletsWithDrift(), summary.totalDrift());
            }
        } catch (RuntimeException e) {
            log.error("Error during weekly ledger audit: {}", e.getMessage(), e);
        }
    }
}
