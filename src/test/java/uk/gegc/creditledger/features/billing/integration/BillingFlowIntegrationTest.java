package uk.gegc.creditledger.features.billing.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.creditledger.features.billing.api.dto.CheckoutResponse;
import uk.gegc.creditledger.features.billing.api.dto.TransactionDto;
import uk.gegc.creditledger.features.billing.api.dto.TransactionPageDto;
import uk.gegc.creditledger.features.billing.api.dto.VerifyPaymentResponse;
import uk.gegc.creditledger.features.billing.application.LedgerAuditService;
import uk.gegc.creditledger.features.billing.application.PaymentGateway;
import uk.gegc.creditledger.features.billing.application.PaymentSessionService;
import uk.gegc.creditledger.features.billing.application.PaymentSessionTransitions;
import uk.gegc.creditledger.features.billing.application.ReconciliationService;
import uk.gegc.creditledger.features.billing.application.ReconciliationService.PaymentCallback;
import uk.gegc.creditledger.features.billing.application.SubscriptionTierService;
import uk.gegc.creditledger.features.billing.application.WalletLedgerService;
import uk.gegc.creditledger.features.billing.domain.exception.InsufficientFundsException;
import uk.gegc.creditledger.features.billing.domain.model.FailureReason;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSessionStatus;
import uk.gegc.creditledger.features.billing.domain.model.TransactionKind;
import uk.gegc.creditledger.features.billing.domain.model.TransactionSource;
import uk.gegc.creditledger.features.billing.domain.model.WalletTransaction;
import uk.gegc.creditledger.features.billing.infra.repository.PaymentSessionRepository;
import uk.gegc.creditledger.features.billing.infra.repository.TierPurchaseRepository;
import uk.gegc.creditledger.features.billing.infra.repository.WalletTransactionRepository;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Full top-up, duplicate callback and tier purchase flows against the in-memory database,
 * with only the payment gateway replaced.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Billing flow integration")
class BillingFlowIntegrationTest {

    @MockitoBean
    private PaymentGateway paymentGateway;

    @Autowired
    private PaymentSessionService paymentSessionService;

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private WalletLedgerService walletLedgerService;

    @Autowired
    private SubscriptionTierService subscriptionTierService;

    @Autowired
    private LedgerAuditService ledgerAuditService;

    @Autowired
    private PaymentSessionRepository paymentSessionRepository;

    @Autowired
    private WalletTransactionRepository transactionRepository;

    @Autowired
    private TierPurchaseRepository tierPurchaseRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private UUID userId;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        when(paymentGateway.createPayment(any())).thenAnswer(inv -> {
            PaymentGateway.PaymentRequest request = inv.getArgument(0);
            String ref = "cs_test_" + request.invoiceId();
            return new PaymentGateway.GatewayCheckout(ref, "https://checkout.example/" + ref);
        });
    }

    private VerifyPaymentResponse pay(CheckoutResponse checkout) {
        when(paymentGateway.verifyPayment(eq(checkout.invoiceId()), anyString()))
                .thenReturn(new PaymentGateway.GatewayVerification(true, checkout.amount(), "paid"));
        return reconciliationService.reconcile(
                new PaymentCallback(checkout.invoiceId(), checkout.externalRef(), "success"), userId);
    }

    @Test
    @DisplayName("two top-ups, a duplicate callback and a rejected overdraft keep the ledger consistent")
    void topUpFlow() {
        // Given
        CheckoutResponse first = paymentSessionService.createTopUpSession(userId, 100, "stripe");
        CheckoutResponse second = paymentSessionService.createTopUpSession(userId, 150, "stripe");

        // When
        VerifyPaymentResponse firstResult = pay(first);
        VerifyPaymentResponse duplicate = pay(first);
        VerifyPaymentResponse secondResult = pay(second);

        // Then
        assertTrue(firstResult.success());
        assertEquals(100L, firstResult.newBalance());
        assertTrue(duplicate.alreadyProcessed());
        assertEquals(250L, secondResult.newBalance());
        assertEquals(1, transactionRepository.countByReferenceId(first.invoiceId().toString()));
        assertEquals(PaymentSessionStatus.COMPLETED,
                paymentSessionRepository.findById(first.invoiceId()).orElseThrow().getStatus());

        assertThatThrownBy(() -> walletLedgerService.debit(userId, 300, TransactionSource.WITHDRAWAL,
                "Withdrawal", null, null))
                .isInstanceOf(InsufficientFundsException.class);
        assertEquals(2, transactionRepository.countByWalletId(userId));

        TransactionPageDto history = walletLedgerService.getHistory(userId, 1, 10);
        assertThat(history.transactions()).extracting(TransactionDto::balanceAfter).containsExactly(250L, 100L);
        assertTrue(ledgerAuditService.auditWallet(userId).consistent());
    }

    @Test
    @DisplayName("gateway tier purchase credits and debits the same amount and upgrades the tier")
    void tierPurchaseThroughGateway() {
        CheckoutResponse checkout = paymentSessionService.createTierUpgradeSession(userId, 1, false);

        VerifyPaymentResponse result = pay(checkout);

        assertTrue(result.success());
        assertEquals(0L, result.newBalance());
        assertEquals(1, subscriptionTierService.getEffectiveTier(userId));
        assertThat(transactionRepository.findByWalletIdOrderByCreatedAtAscIdAsc(userId))
                .extracting(WalletTransaction::getKind)
                .containsExactly(TransactionKind.CREDIT, TransactionKind.DEBIT);
        assertThat(tierPurchaseRepository.findByPaymentReference(checkout.invoiceId().toString())).isPresent();
        assertTrue(ledgerAuditService.auditWallet(userId).consistent());
    }

    @Test
    @DisplayName("paid upgrade that no longer applies leaves the money in the wallet")
    void staleUpgradeKeepsCredit() {
        CheckoutResponse checkout = paymentSessionService.createTierUpgradeSession(userId, 1, false);
        walletLedgerService.credit(userId, 2000, TransactionSource.ADJUSTMENT, "Goodwill", null, null);
        subscriptionTierService.purchaseWithWallet(userId, 3, false);

        VerifyPaymentResponse result = pay(checkout);

        assertTrue(result.success());
        assertEquals(3, subscriptionTierService.getEffectiveTier(userId));
        assertEquals(checkout.amount(), walletLedgerService.getBalance(userId));
        assertTrue(ledgerAuditService.auditWallet(userId).consistent());
    }

    @Test
    @DisplayName("frozen wallet at completion fails the session and writes nothing")
    void frozenWalletAtCompletion() {
        CheckoutResponse checkout = paymentSessionService.createTopUpSession(userId, 500, "stripe");
        walletLedgerService.freeze(userId, "chargeback investigation");

        VerifyPaymentResponse result = pay(checkout);

        assertFalse(result.success());
        assertEquals(FailureReason.WALLET_FROZEN, result.failureReason());
        assertEquals(0, transactionRepository.countByWalletId(userId));
        assertEquals(PaymentSessionStatus.FAILED,
                paymentSessionRepository.findById(checkout.invoiceId()).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("cancelled payment fails the session without touching the wallet")
    void cancelledPayment() {
        CheckoutResponse checkout = paymentSessionService.createTopUpSession(userId, 500, "stripe");

        VerifyPaymentResponse result = reconciliationService.reconcile(
                new PaymentCallback(checkout.invoiceId(), checkout.externalRef(), "cancelled"), userId);

        assertFalse(result.success());
        assertEquals(FailureReason.CANCELLED, result.failureReason());
        assertEquals(0, walletLedgerService.getBalance(userId));
    }

    @Test
    @DisplayName("checkout completed with an unsettled payment is credited when the settlement event arrives")
    void delayedSettlement() {
        // Given
        CheckoutResponse checkout = paymentSessionService.createTopUpSession(userId, 500, "stripe");
        PaymentCallback browserReturn = new PaymentCallback(checkout.invoiceId(), checkout.externalRef(), "success");
        when(paymentGateway.verifyPayment(eq(checkout.invoiceId()), anyString()))
                .thenReturn(PaymentGateway.GatewayVerification.awaitingSettlement(500,
                        "status=complete payment_status=unpaid"));

        // When
        VerifyPaymentResponse onReturn = reconciliationService.reconcile(browserReturn, userId);
        int swept = transactionTemplate.execute(tx -> paymentSessionRepository.expireIfStale(
                checkout.invoiceId(), PaymentSessionTransitions.OPEN, LocalDateTime.now().plusDays(3)));

        when(paymentGateway.verifyPayment(eq(checkout.invoiceId()), anyString()))
                .thenReturn(new PaymentGateway.GatewayVerification(true, 500, "paid"));
        VerifyPaymentResponse onSettlement = reconciliationService.reconcile(browserReturn, null);

        // Then
        assertFalse(onReturn.success());
        assertEquals(PaymentSessionStatus.VERIFYING, onReturn.status());
        assertEquals(0, swept);
        assertTrue(onSettlement.success());
        assertEquals(PaymentSessionStatus.COMPLETED, onSettlement.status());
        assertEquals(500L, walletLedgerService.getBalance(userId));
        assertEquals(PaymentSessionStatus.COMPLETED,
                paymentSessionRepository.findById(checkout.invoiceId()).orElseThrow().getStatus());
        assertEquals(1, transactionRepository.countByWalletId(userId));
    }
}
