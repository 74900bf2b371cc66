package uk.gegc.creditledger.features.billing.infra.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.creditledger.features.billing.application.PaymentSessionTransitions;
import uk.gegc.creditledger.features.billing.domain.model.FailureReason;
import uk.gegc.creditledger.features.billing.domain.model.PaymentPurpose;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSession;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSessionStatus;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class PaymentSessionRepositoryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 1, 12, 0);

    @Autowired
    private PaymentSessionRepository paymentSessionRepository;

    @Autowired
    private TestEntityManager entityManager;

    private UUID userId;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
    }

    private PaymentSession persist(PaymentSessionStatus status, LocalDateTime expiresAt) {
        PaymentSession session = new PaymentSession();
        session.setInvoiceId(UUID.randomUUID());
        session.setUserId(userId);
        session.setExternalRef("cs_test_" + UUID.randomUUID());
        session.setAmount(5000);
        session.setCurrency("usd");
        session.setPurpose(PaymentPurpose.WALLET_TOPUP);
        session.setStatus(status);
        session.setCreatedAt(NOW.minusMinutes(10));
        session.setExpiresAt(expiresAt);
        entityManager.persist(session);
        entityManager.flush();
        return session;
    }

    private PaymentSessionStatus statusOf(UUID invoiceId) {
        return paymentSessionRepository.findById(invoiceId).orElseThrow().getStatus();
    }

    @Test
    @DisplayName("transition only succeeds from the expected status")
    void transitionIsCompareAndSet() {
        PaymentSession session = persist(PaymentSessionStatus.PENDING, NOW.plusHours(1));

        int first = paymentSessionRepository.transition(session.getInvoiceId(),
                PaymentSessionStatus.PENDING, PaymentSessionStatus.VERIFYING);
        int second = paymentSessionRepository.transition(session.getInvoiceId(),
                PaymentSessionStatus.PENDING, PaymentSessionStatus.VERIFYING);

        assertEquals(1, first);
        assertEquals(0, second);
        assertEquals(PaymentSessionStatus.VERIFYING, statusOf(session.getInvoiceId()));
    }

    @Test
    @DisplayName("completion requires a verifying session and sets consumed_at")
    void markCompleted() {
        PaymentSession pending = persist(PaymentSessionStatus.PENDING, NOW.plusHours(1));
        PaymentSession verifying = persist(PaymentSessionStatus.VERIFYING, NOW.plusHours(1));

        assertEquals(0, paymentSessionRepository.markCompleted(pending.getInvoiceId(), NOW));
        assertEquals(1, paymentSessionRepository.markCompleted(verifying.getInvoiceId(), NOW));
        assertEquals(0, paymentSessionRepository.markCompleted(verifying.getInvoiceId(), NOW));

        PaymentSession completed = paymentSessionRepository.findById(verifying.getInvoiceId()).orElseThrow();
        assertEquals(PaymentSessionStatus.COMPLETED, completed.getStatus());
        assertNotNull(completed.getConsumedAt());
    }

    @Test
    @DisplayName("completed session cannot be failed afterwards")
    void markFailedOnlyWhileOpen() {
        PaymentSession verifying = persist(PaymentSessionStatus.VERIFYING, NOW.plusHours(1));
        PaymentSession completed = persist(PaymentSessionStatus.COMPLETED, NOW.plusHours(1));

        assertEquals(1, paymentSessionRepository.markFailed(verifying.getInvoiceId(), PaymentSessionTransitions.OPEN,
                FailureReason.CANCELLED, "cancelled by user"));
        assertEquals(0, paymentSessionRepository.markFailed(completed.getInvoiceId(), PaymentSessionTransitions.OPEN,
                FailureReason.CANCELLED, "late cancel"));

        PaymentSession failed = paymentSessionRepository.findById(verifying.getInvoiceId()).orElseThrow();
        assertEquals(PaymentSessionStatus.FAILED, failed.getStatus());
        assertEquals(FailureReason.CANCELLED, failed.getFailureReason());
        assertEquals(PaymentSessionStatus.COMPLETED, statusOf(completed.getInvoiceId()));
    }

    @Test
    @DisplayName("sweep expires only open sessions past their expiry")
    void expireStale() {
        PaymentSession stalePending = persist(PaymentSessionStatus.PENDING, NOW.minusMinutes(1));
        PaymentSession staleVerifying = persist(PaymentSessionStatus.VERIFYING, NOW);
        PaymentSession fresh = persist(PaymentSessionStatus.PENDING, NOW.plusMinutes(1));
        PaymentSession staleCompleted = persist(PaymentSessionStatus.COMPLETED, NOW.minusHours(1));

        int expired = paymentSessionRepository.expireStale(PaymentSessionTransitions.OPEN, NOW);

        assertEquals(2, expired);
        assertEquals(PaymentSessionStatus.EXPIRED, statusOf(stalePending.getInvoiceId()));
        assertEquals(PaymentSessionStatus.EXPIRED, statusOf(staleVerifying.getInvoiceId()));
        assertEquals(PaymentSessionStatus.PENDING, statusOf(fresh.getInvoiceId()));
        assertEquals(PaymentSessionStatus.COMPLETED, statusOf(staleCompleted.getInvoiceId()));
    }

    @Test
    @DisplayName("single-session expiry ignores sessions that are still valid")
    void expireIfStale() {
        PaymentSession fresh = persist(PaymentSessionStatus.PENDING, NOW.plusMinutes(5));

        assertEquals(0, paymentSessionRepository.expireIfStale(fresh.getInvoiceId(),
                PaymentSessionTransitions.OPEN, NOW));
        assertEquals(1, paymentSessionRepository.expireIfStale(fresh.getInvoiceId(),
                PaymentSessionTransitions.OPEN, NOW.plusMinutes(5)));
    }

    @Test
    @DisplayName("only a verifying session can be marked as awaiting settlement")
    void markAwaitingSettlement() {
        PaymentSession pending = persist(PaymentSessionStatus.PENDING, NOW.plusHours(1));
        PaymentSession verifying = persist(PaymentSessionStatus.VERIFYING, NOW.plusHours(1));

        assertEquals(0, paymentSessionRepository.markAwaitingSettlement(pending.getInvoiceId()));
        assertEquals(1, paymentSessionRepository.markAwaitingSettlement(verifying.getInvoiceId()));

        PaymentSession awaiting = paymentSessionRepository.findById(verifying.getInvoiceId()).orElseThrow();
        assertTrue(awaiting.isAwaitingSettlement());
        assertEquals(PaymentSessionStatus.VERIFYING, awaiting.getStatus());
    }

    @Test
    @DisplayName("expiry never touches a session whose payment is still settling")
    void settlingSessionOutlivesTtl() {
        PaymentSession settling = persist(PaymentSessionStatus.VERIFYING, NOW.minusHours(2));
        paymentSessionRepository.markAwaitingSettlement(settling.getInvoiceId());

        assertEquals(0, paymentSessionRepository.expireStale(PaymentSessionTransitions.OPEN, NOW));
        assertEquals(0, paymentSessionRepository.expireIfStale(settling.getInvoiceId(),
                PaymentSessionTransitions.OPEN, NOW));
        assertEquals(PaymentSessionStatus.VERIFYING, statusOf(settling.getInvoiceId()));

        assertEquals(1, paymentSessionRepository.markCompleted(settling.getInvoiceId(), NOW));
    }

    @Test
    @DisplayName("sessions are only visible to their owner")
    void findByOwner() {
        PaymentSession session = persist(PaymentSessionStatus.PENDING, NOW.plusHours(1));

        assertTrue(paymentSessionRepository.findByInvoiceIdAndUserId(session.getInvoiceId(), userId).isPresent());
        assertTrue(paymentSessionRepository.findByInvoiceIdAndUserId(session.getInvoiceId(), UUID.randomUUID()).isEmpty());
    }
}
