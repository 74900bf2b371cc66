package uk.gegc.creditledger.features.billing.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.creditledger.features.billing.api.dto.CheckoutResponse;
import uk.gegc.creditledger.features.billing.application.BillingMetricsService;
import uk.gegc.creditledger.features.billing.application.BillingProperties;
import uk.gegc.creditledger.features.billing.application.GatewayRetryExecutor;
import uk.gegc.creditledger.features.billing.application.PaymentGateway;
import uk.gegc.creditledger.features.billing.application.PaymentSessionTransitions;
import uk.gegc.creditledger.features.billing.application.SubscriptionTierService;
import uk.gegc.creditledger.features.billing.application.TierCatalog;
import uk.gegc.creditledger.features.billing.application.WalletLedgerService;
import uk.gegc.creditledger.features.billing.domain.exception.GatewayUnavailableException;
import uk.gegc.creditledger.features.billing.domain.exception.RecoverableGatewayException;
import uk.gegc.creditledger.features.billing.domain.exception.SessionNotFoundException;
import uk.gegc.creditledger.features.billing.domain.exception.TerminalGatewayException;
import uk.gegc.creditledger.features.billing.domain.exception.WalletFrozenException;
import uk.gegc.creditledger.features.billing.domain.model.BillingCycle;
import uk.gegc.creditledger.features.billing.domain.model.FailureReason;
import uk.gegc.creditledger.features.billing.domain.model.PaymentPurpose;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSession;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSessionStatus;
import uk.gegc.creditledger.features.billing.domain.model.UpgradeQuote;
import uk.gegc.creditledger.features.billing.infra.mapping.PaymentSessionMapper;
import uk.gegc.creditledger.features.billing.infra.repository.PaymentSessionRepository;
import uk.gegc.creditledger.features.billing.testutils.BillingTestFixtures;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentSessionServiceImpl Tests")
class PaymentSessionServiceImplTest {

    @Mock
    private PaymentSessionRepository paymentSessionRepository;

    @Mock
    private PaymentSessionTransitions transitions;

    @Mock
    private PaymentGateway paymentGateway;

    @Mock
    private WalletLedgerService walletLedgerService;

    @Mock
    private SubscriptionTierService subscriptionTierService;

    @Mock
    private PaymentSessionMapper paymentSessionMapper;

    @Mock
    private BillingMetricsService metricsService;

    private PaymentSessionServiceImpl paymentSessionService;
    private BillingProperties billingProperties;
    private Clock clock;
    private UUID userId;

    @BeforeEach
    void setUp() {
        clock = BillingTestFixtures.fixedClock();
        billingProperties = BillingTestFixtures.billingProperties();
        billingProperties.getGateway().setBackoffMs(0);
        TierCatalog tierCatalog = new TierCatalog(billingProperties);
        GatewayRetryExecutor retryExecutor = new GatewayRetryExecutor(billingProperties, metricsService);
        paymentSessionService = new PaymentSessionServiceImpl(paymentSessionRepository, transitions, paymentGateway,
                retryExecutor, walletLedgerService, subscriptionTierService, tierCatalog, paymentSessionMapper,
                metricsService, billingProperties, clock);
        userId = UUID.randomUUID();
    }

    @Nested
    @DisplayName("createTopUpSession")
    class TopUp {

        @Test
        @DisplayName("opens a pending session with the gateway reference and expiry")
        void opensSession() {
            // Given
            when(paymentGateway.createPayment(any())).thenReturn(
                    new PaymentGateway.GatewayCheckout("cs_test_1", "https://checkout.example/cs_test_1"));

            // When
            CheckoutResponse response = paymentSessionService.createTopUpSession(userId, 5000, "Stripe");

            // Then
            ArgumentCaptor<PaymentSession> captor = ArgumentCaptor.forClass(PaymentSession.class);
            verify(transitions).save(captor.capture());
            PaymentSession saved = captor.getValue();
            assertEquals(PaymentSessionStatus.PENDING, saved.getStatus());
            assertEquals(PaymentPurpose.WALLET_TOPUP, saved.getPurpose());
            assertEquals("cs_test_1", saved.getExternalRef());
            assertEquals("usd", saved.getCurrency());
            assertEquals(LocalDateTime.now(clock).plusMinutes(billingProperties.getSessionTtlMinutes()),
                    saved.getExpiresAt());

            assertEquals(saved.getInvoiceId(), response.invoiceId());
            assertEquals("https://checkout.example/cs_test_1", response.redirectUrl());
            assertEquals(5000, response.amount());
            verify(metricsService).incrementSessionCreated(PaymentPurpose.WALLET_TOPUP, 5000);
        }

        @Test
        @DisplayName("gateway receives the invoice id and amount")
        void sendsInvoiceToGateway() {
            when(paymentGateway.createPayment(any())).thenReturn(
                    new PaymentGateway.GatewayCheckout("cs_test_1", "https://checkout.example/cs_test_1"));

            CheckoutResponse response = paymentSessionService.createTopUpSession(userId, 2500, "stripe");

            ArgumentCaptor<PaymentGateway.PaymentRequest> captor = ArgumentCaptor.forClass(PaymentGateway.PaymentRequest.class);
            verify(paymentGateway).createPayment(captor.capture());
            assertEquals(response.invoiceId(), captor.getValue().invoiceId());
            assertEquals(2500, captor.getValue().amount());
            assertEquals("Wallet top-up", captor.getValue().description());
        }

        @Test
        @DisplayName("unknown payment method is rejected before any session exists")
        void unsupportedMethod() {
            assertThatThrownBy(() -> paymentSessionService.createTopUpSession(userId, 5000, "paypal"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unsupported payment method");
            verifyNoInteractions(paymentGateway, transitions);
        }

        @Test
        @DisplayName("amount outside the configured bounds is rejected")
        void amountOutOfBounds() {
            assertThatThrownBy(() -> paymentSessionService.createTopUpSession(userId, 99, "stripe"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> paymentSessionService.createTopUpSession(userId,
                    billingProperties.getMaxTopUp() + 1, "stripe"))
                    .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(paymentGateway);
        }

        @Test
        @DisplayName("frozen wallet cannot start a top-up")
        void frozenWallet() {
            doThrow(new WalletFrozenException(userId)).when(walletLedgerService).requireNotFrozen(userId);

            assertThatThrownBy(() -> paymentSessionService.createTopUpSession(userId, 5000, "stripe"))
                    .isInstanceOf(WalletFrozenException.class);
            verifyNoInteractions(paymentGateway);
        }

        @Test
        @DisplayName("terminal gateway error stores a failed session and propagates")
        void terminalGatewayError() {
            when(paymentGateway.createPayment(any())).thenThrow(new TerminalGatewayException("Invalid currency", null));

            assertThatThrownBy(() -> paymentSessionService.createTopUpSession(userId, 5000, "stripe"))
                    .isInstanceOf(TerminalGatewayException.class);

            ArgumentCaptor<PaymentSession> captor = ArgumentCaptor.forClass(PaymentSession.class);
            verify(transitions).save(captor.capture());
            assertEquals(PaymentSessionStatus.FAILED, captor.getValue().getStatus());
            assertEquals(FailureReason.GATEWAY_ERROR, captor.getValue().getFailureReason());
            verify(metricsService).incrementSessionFailed(FailureReason.GATEWAY_ERROR);
        }

        @Test
        @DisplayName("unreachable gateway stores nothing")
        void gatewayUnavailable() {
            when(paymentGateway.createPayment(any())).thenThrow(new RecoverableGatewayException("timeout", null));

            assertThatThrownBy(() -> paymentSessionService.createTopUpSession(userId, 5000, "stripe"))
                    .isInstanceOf(GatewayUnavailableException.class);
            verify(transitions, never()).save(any());
            verify(metricsService, never()).incrementSessionCreated(any(), anyLong());
        }
    }

    @Nested
    @DisplayName("createTierUpgradeSession")
    class TierUpgrade {

        @Test
        @DisplayName("session carries the quoted amount and target tier")
        void quotedSession() {
            when(subscriptionTierService.quoteUpgrade(userId, 2, BillingCycle.YEARLY))
                    .thenReturn(new UpgradeQuote(1, 2, BillingCycle.YEARLY, 15000, 500, 14500));
            when(paymentGateway.createPayment(any())).thenReturn(
                    new PaymentGateway.GatewayCheckout("cs_test_2", "https://checkout.example/cs_test_2"));

            CheckoutResponse response = paymentSessionService.createTierUpgradeSession(userId, 2, true);

            ArgumentCaptor<PaymentSession> captor = ArgumentCaptor.forClass(PaymentSession.class);
            verify(transitions).save(captor.capture());
            PaymentSession saved = captor.getValue();
            assertEquals(14500, saved.getAmount());
            assertEquals(PaymentPurpose.SUBSCRIPTION_TIER, saved.getPurpose());
            assertEquals(2, saved.getTargetTier());
            assertEquals(BillingCycle.YEARLY, saved.getTargetCycle());
            assertEquals(15000L, saved.getQuotedTotalCost());
            assertEquals(500L, saved.getQuotedCreditApplied());
            assertEquals(14500, response.amount());

            ArgumentCaptor<PaymentGateway.PaymentRequest> request = ArgumentCaptor.forClass(PaymentGateway.PaymentRequest.class);
            verify(paymentGateway).createPayment(request.capture());
            assertThat(request.getValue().description()).isEqualTo("Subscription upgrade to Silver (yearly)");
        }

        @Test
        @DisplayName("fully covered upgrade must be bought with the wallet")
        void nothingToPay() {
            when(subscriptionTierService.quoteUpgrade(userId, 2, BillingCycle.MONTHLY))
                    .thenReturn(new UpgradeQuote(1, 2, BillingCycle.MONTHLY, 1500, 1500, 0));

            assertThatThrownBy(() -> paymentSessionService.createTierUpgradeSession(userId, 2, false))
                    .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(paymentGateway);
        }
    }

    @Nested
    @DisplayName("reads and expiry")
    class Reads {

        @Test
        @DisplayName("session of another user is not found")
        void foreignSession() {
            UUID invoiceId = UUID.randomUUID();
            when(paymentSessionRepository.findByInvoiceIdAndUserId(invoiceId, userId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> paymentSessionService.getSession(userId, invoiceId))
                    .isInstanceOf(SessionNotFoundException.class);
        }

        @Test
        @DisplayName("sweep expires open sessions and records the count")
        void expireStale() {
            when(paymentSessionRepository.expireStale(eq(PaymentSessionTransitions.OPEN), any())).thenReturn(3);

            int expired = paymentSessionService.expireStaleSessions();

            assertEquals(3, expired);
            verify(metricsService).incrementSessionsExpired(3);
        }

        @Test
        @DisplayName("empty sweep records nothing")
        void expireNothing() {
            when(paymentSessionRepository.expireStale(eq(PaymentSessionTransitions.OPEN), any())).thenReturn(0);

            assertEquals(0, paymentSessionService.expireStaleSessions());
            verify(metricsService, never()).incrementSessionsExpired(org.mockito.ArgumentMatchers.anyInt());
        }
    }
}
