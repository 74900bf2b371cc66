package uk.gegc.creditledger.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.creditledger.features.billing.domain.model.FailureReason;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSession;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSessionStatus;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Status changes are compare-and-set updates: each returns the number of rows that were
 * still in the expected state, so 0 means another caller got there first.
 */
public interface PaymentSessionRepository extends JpaRepository<PaymentSession, UUID> {

    Optional<PaymentSession> findByInvoiceIdAndUserId(UUID invoiceId, UUID userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update PaymentSession s
           set s.status = :to, s.version = s.version + 1
         where s.invoiceId = :invoiceId and s.status = :from
    """)
    int transition(@Param("invoiceId") UUID invoiceId,
                   @Param("from") PaymentSessionStatus from,
                   @Param("to") PaymentSessionStatus to);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update PaymentSession s
           set s.status = uk.gegc.creditledger.features.billing.domain.model.PaymentSessionStatus.FAILED,
               s.failureReason = :reason,
               s.failureMessage = :message,
               s.version = s.version + 1
         where s.invoiceId = :invoiceId and s.status in :from
    """)
    int markFailed(@Param("invoiceId") UUID invoiceId,
                   @Param("from") Collection<PaymentSessionStatus> from,
                   @Param("reason") FailureReason reason,
                   @Param("message") String message);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update PaymentSession s
           set s.status = uk.gegc.creditledger.features.billing.domain.model.PaymentSessionStatus.COMPLETED,
               s.consumedAt = :now,
               s.version = s.version + 1
         where s.invoiceId = :invoiceId
           and s.status = uk.gegc.creditledger.features.billing.domain.model.PaymentSessionStatus.VERIFYING
    """)
    int markCompleted(@Param("invoiceId") UUID invoiceId, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update PaymentSession s
           set s.awaitingSettlement = true,
               s.version = s.version + 1
         where s.invoiceId = :invoiceId
           and s.status = uk.gegc.creditledger.features.billing.domain.model.PaymentSessionStatus.VERIFYING
    """)
    int markAwaitingSettlement(@Param("invoiceId") UUID invoiceId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update PaymentSession s
           set s.creditTransactionId = :transactionId
         where s.invoiceId = :invoiceId
    """)
    int recordCreditTransaction(@Param("invoiceId") UUID invoiceId, @Param("transactionId") Long transactionId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update PaymentSession s
           set s.status = uk.gegc.creditledger.features.billing.domain.model.PaymentSessionStatus.EXPIRED,
               s.version = s.version + 1
         where s.status in :from and s.expiresAt <= :now and s.awaitingSettlement = false
    """)
    int expireStale(@Param("from") Collection<PaymentSessionStatus> from, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update PaymentSession s
           set s.status = uk.gegc.creditledger.features.billing.domain.model.PaymentSessionStatus.EXPIRED,
               s.version = s.version + 1
         where s.invoiceId = :invoiceId and s.status in :from and s.expiresAt <= :now
           and s.awaitingSettlement = false
    """)
    int expireIfStale(@Param("invoiceId") UUID invoiceId,
                      @Param("from") Collection<PaymentSessionStatus> from,
                      @Param("now") LocalDateTime now);
}
