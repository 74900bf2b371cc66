package uk.gegc.creditledger.features.billing.application;

import java.util.List;
import java.util.UUID;

/**
 * Replays wallet ledgers to prove each balance is reconstructible from its transactions.
 */
public interface LedgerAuditService {

    /**
     * Audit a single wallet.
     */
    AuditResult auditWallet(UUID ownerId);

    /**
     * Audit every wallet.
     */
    AuditSummary auditAllWallets();

    record AuditResult(
            UUID ownerId,
            boolean consistent,
            long replayedBalance,
            long actualBalance,
            long drift,
            int transactionCount,
            int mismatchedRows,
            String details
    ) {
        public boolean hasDrift() {
            return !consistent;
        }
    }

    record AuditSummary(
            int totalWallets,
            int consistentWallets,
            int walletsWithDrift,
            long totalDrift,
            List<AuditResult> driftResults
    ) {
        public boolean isSuccessful() {
            return walletsWithDrift == 0;
        }
    }
}
