package uk.gegc.creditledger.features.billing.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.creditledger.features.billing.application.StripeWebhookService;
import uk.gegc.creditledger.features.billing.domain.exception.WebhookInvalidSignatureException;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("StripeWebhookController Tests")
class StripeWebhookControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StripeWebhookService webhookService;

    @Test
    @DisplayName("signed event is accepted without user authentication")
    void acceptsSignedEvent() throws Exception {
        when(webhookService.process(anyString(), eq("t=1,v1=abc"))).thenReturn(StripeWebhookService.Result.OK);

        mockMvc.perform(post("/api/v1/payments/stripe/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Stripe-Signature", "t=1,v1=abc")
                        .content("{\"id\":\"evt_1\"}"))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("redelivered event is acknowledged")
    void acknowledgesDuplicate() throws Exception {
        when(webhookService.process(anyString(), anyString())).thenReturn(StripeWebhookService.Result.DUPLICATE);

        mockMvc.perform(post("/api/v1/payments/stripe/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Stripe-Signature", "t=1,v1=abc")
                        .content("{\"id\":\"evt_1\"}"))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("bad signature is a 401")
    void rejectsBadSignature() throws Exception {
        when(webhookService.process(anyString(), anyString()))
                .thenThrow(new WebhookInvalidSignatureException("Invalid Stripe signature"));

        mockMvc.perform(post("/api/v1/payments/stripe/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Stripe-Signature", "t=1,v1=bad")
                        .content("{\"id\":\"evt_1\"}"))
                .andExpect(status().isUnauthorized());
    }
}
