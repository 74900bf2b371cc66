package uk.gegc.creditledger.features.billing.application.impl;

import com.stripe.Stripe;
import com.stripe.net.Webhook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.creditledger.features.billing.api.dto.VerifyPaymentResponse;
import uk.gegc.creditledger.features.billing.application.BillingMetricsService;
import uk.gegc.creditledger.features.billing.application.ReconciliationService;
import uk.gegc.creditledger.features.billing.application.StripeProperties;
import uk.gegc.creditledger.features.billing.application.StripeWebhookService.Result;
import uk.gegc.creditledger.features.billing.domain.exception.SessionExpiredException;
import uk.gegc.creditledger.features.billing.domain.exception.SessionMismatchException;
import uk.gegc.creditledger.features.billing.domain.exception.WebhookInvalidSignatureException;
import uk.gegc.creditledger.features.billing.domain.model.PaymentSessionStatus;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StripeWebhookServiceImpl Tests")
class StripeWebhookServiceImplTest {

    private static final String SECRET = "whsec_test_secret";

    @Mock
    private ReconciliationService reconciliationService;

    @Mock
    private BillingMetricsService metricsService;

    private StripeProperties stripeProperties;
    private StripeWebhookServiceImpl webhookService;
    private UUID invoiceId;

    @BeforeEach
    void setUp() {
        stripeProperties = new StripeProperties();
        stripeProperties.setWebhookSecret(SECRET);
        webhookService = new StripeWebhookServiceImpl(stripeProperties, reconciliationService, metricsService);
        invoiceId = UUID.randomUUID();
    }

    private String event(String type, String paymentStatus) {
        return """
                {
                  "id": "evt_test_1",
                  "object": "event",
                  "api_version": "%s",
                  "type": "%s",
                  "data": {
                    "object": {
                      "id": "cs_test_1",
                      "object": "checkout.session",
                      "client_reference_id": "%s",
                      "payment_status": "%s",
                      "metadata": { "invoice_id": "%s" }
                    }
                  }
                }
                """.formatted(Stripe.API_VERSION, type, invoiceId, paymentStatus, invoiceId);
    }

    private static String sign(String payload) throws Exception {
        long timestamp = Webhook.Util.getTimeNow();
        String signature = Webhook.Util.computeHmacSha256(SECRET, timestamp + "." + payload);
        return "t=" + timestamp + ",v1=" + signature;
    }

    private VerifyPaymentResponse completed(boolean alreadyProcessed) {
        return new VerifyPaymentResponse(true, "ok", invoiceId, PaymentSessionStatus.COMPLETED, null,
                alreadyProcessed, 100L);
    }

    @Nested
    @DisplayName("Signature")
    class Signature {

        @Test
        @DisplayName("bad signature is rejected before anything is reconciled")
        void invalidSignature() {
            String payload = event("checkout.session.completed", "paid");

            assertThatThrownBy(() -> webhookService.process(payload, "t=1,v1=deadbeef"))
                    .isInstanceOf(WebhookInvalidSignatureException.class);
            verifyNoInteractions(reconciliationService, metricsService);
        }

        @Test
        @DisplayName("missing webhook secret rejects every event")
        void missingSecret() throws Exception {
            stripeProperties.setWebhookSecret(" ");
            String payload = event("checkout.session.completed", "paid");

            assertThatThrownBy(() -> webhookService.process(payload, sign(payload)))
                    .isInstanceOf(WebhookInvalidSignatureException.class);
        }
    }

    @Nested
    @DisplayName("Events")
    class Events {

        @Test
        @DisplayName("paid checkout completion reconciles as a success without a requesting user")
        void completedPaid() throws Exception {
            // Given
            String payload = event("checkout.session.completed", "paid");
            when(reconciliationService.reconcile(any(), isNull())).thenReturn(completed(false));

            // When
            Result result = webhookService.process(payload, sign(payload));

            // Then
            assertEquals(Result.OK, result);
            ArgumentCaptor<ReconciliationService.PaymentCallback> captor =
                    ArgumentCaptor.forClass(ReconciliationService.PaymentCallback.class);
            verify(reconciliationService).reconcile(captor.capture(), isNull());
            assertEquals(invoiceId, captor.getValue().invoiceId());
            assertEquals("cs_test_1", captor.getValue().externalRef());
            assertEquals("success", captor.getValue().gatewayStatus());
            verify(metricsService).incrementWebhookReceived("checkout.session.completed");
        }

        @Test
        @DisplayName("event pinned to an older API version still resolves the invoice from client_reference_id")
        void olderApiVersion() throws Exception {
            // Given
            String payload = """
                    {"id":"evt_test_3","object":"event","api_version":"2020-08-27",
                     "type":"checkout.session.async_payment_succeeded",
                     "data":{"object":{"id":"cs_test_3","object":"checkout.session",
                                       "client_reference_id":"%s","payment_status":"paid"}}}
                    """.formatted(invoiceId);
            when(reconciliationService.reconcile(any(), isNull())).thenReturn(completed(false));

            // When
            Result result = webhookService.process(payload, sign(payload));

            // Then
            assertEquals(Result.OK, result);
            verify(reconciliationService).reconcile(
                    new ReconciliationService.PaymentCallback(invoiceId, "cs_test_3", "success"), null);
        }

        @Test
        @DisplayName("redelivered event is reported as a duplicate")
        void duplicateDelivery() throws Exception {
            String payload = event("checkout.session.completed", "paid");
            when(reconciliationService.reconcile(any(), isNull())).thenReturn(completed(true));

            assertEquals(Result.DUPLICATE, webhookService.process(payload, sign(payload)));
        }

        @Test
        @DisplayName("unpaid completion waits for the async payment event")
        void completedUnpaid() throws Exception {
            String payload = event("checkout.session.completed", "unpaid");

            assertEquals(Result.IGNORED, webhookService.process(payload, sign(payload)));
            verifyNoInteractions(reconciliationService);
        }

        @Test
        @DisplayName("async failure and expiry pass their status through")
        void asyncFailureAndExpiry() throws Exception {
            String failed = event("checkout.session.async_payment_failed", "unpaid");
            String expired = event("checkout.session.expired", "unpaid");
            when(reconciliationService.reconcile(any(), isNull())).thenReturn(
                    new VerifyPaymentResponse(false, "failed", invoiceId, PaymentSessionStatus.FAILED, null, false, null));

            webhookService.process(failed, sign(failed));
            webhookService.process(expired, sign(expired));

            ArgumentCaptor<ReconciliationService.PaymentCallback> captor =
                    ArgumentCaptor.forClass(ReconciliationService.PaymentCallback.class);
            verify(reconciliationService, org.mockito.Mockito.times(2)).reconcile(captor.capture(), isNull());
            assertEquals("failed", captor.getAllValues().get(0).gatewayStatus());
            assertEquals("expired", captor.getAllValues().get(1).gatewayStatus());
        }

        @Test
        @DisplayName("unhandled event types are ignored")
        void unhandledType() throws Exception {
            String payload = event("customer.created", "paid");

            assertEquals(Result.IGNORED, webhookService.process(payload, sign(payload)));
            verifyNoInteractions(reconciliationService);
        }

        @Test
        @DisplayName("event for an unknown session is acknowledged and ignored")
        void unknownSession() throws Exception {
            String payload = event("checkout.session.completed", "paid");
            when(reconciliationService.reconcile(any(), isNull()))
                    .thenThrow(new SessionMismatchException("Payment callback does not match any payment session"));

            assertEquals(Result.IGNORED, webhookService.process(payload, sign(payload)));
        }

        @Test
        @DisplayName("event for an expired session is acknowledged")
        void expiredSession() throws Exception {
            String payload = event("checkout.session.completed", "paid");
            when(reconciliationService.reconcile(any(), isNull())).thenThrow(new SessionExpiredException(invoiceId));

            assertEquals(Result.OK, webhookService.process(payload, sign(payload)));
        }

        @Test
        @DisplayName("event without an invoice reference is ignored")
        void missingInvoice() throws Exception {
            String payload = """
                    {"id":"evt_test_2","object":"event","type":"checkout.session.completed",
                     "data":{"object":{"id":"cs_test_2","object":"checkout.session","payment_status":"paid"}}}
                    """;

            assertEquals(Result.IGNORED, webhookService.process(payload, sign(payload)));
            verifyNoInteractions(reconciliationService);
        }
    }
}
