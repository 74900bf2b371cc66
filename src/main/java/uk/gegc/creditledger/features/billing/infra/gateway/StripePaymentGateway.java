package uk.gegc.creditledger.features.billing.infra.gateway;

import com.stripe.StripeClient;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.ApiException;
import com.stripe.exception.RateLimitException;
import com.stripe.exception.StripeException;
import com.stripe.model.checkout.Session;
import com.stripe.param.checkout.SessionCreateParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.creditledger.features.billing.application.PaymentGateway;
import uk.gegc.creditledger.features.billing.application.StripeProperties;
import uk.gegc.creditledger.features.billing.domain.exception.GatewayUnavailableException;
import uk.gegc.creditledger.features.billing.domain.exception.PaymentGatewayException;
import uk.gegc.creditledger.features.billing.domain.exception.RecoverableGatewayException;
import uk.gegc.creditledger.features.billing.domain.exception.TerminalGatewayException;

import java.util.Map;
import java.util.UUID;

/**
 * {@link PaymentGateway} backed by Stripe Checkout. The Checkout session id is the external reference;
 * the invoice id travels as {@code client_reference_id} and {@code metadata.invoice_id}.
 */
@Slf4j
@Component
public class StripePaymentGateway implements PaymentGateway {

    static final String INVOICE_METADATA_KEY = "invoice_id";
    private static final String INVOICE_PLACEHOLDER = "{INVOICE_ID}";

    private final StripeProperties stripeProperties;
    private final StripeClient stripeClient;

    public StripePaymentGateway(StripeProperties stripeProperties, ObjectProvider<StripeClient> stripeClient) {
        this.stripeProperties = stripeProperties;
        this.stripeClient = stripeClient.getIfAvailable();
    }

    @Override
    public GatewayCheckout createPayment(PaymentRequest request) {
        String invoiceId = request.invoiceId().toString();

        SessionCreateParams params = SessionCreateParams.builder()
                .setMode(SessionCreateParams.Mode.PAYMENT)
                .setSuccessUrl(successUrl(invoiceId))
                .setCancelUrl(redirectUrl(stripeProperties.getCancelUrl(), invoiceId))
                .setClientReferenceId(invoiceId)
                .putMetadata(INVOICE_METADATA_KEY, invoiceId)
                .setExpiresAt(request.expiresAt().getEpochSecond())
                .addLineItem(
                        SessionCreateParams.LineItem.builder()
                                .setQuantity(1L)
                                .setPriceData(
                                        SessionCreateParams.LineItem.PriceData.builder()
                                                .setCurrency(request.currency())
                                                .setUnitAmount(request.amount())
                                                .setProductData(
                                                        SessionCreateParams.LineItem.PriceData.ProductData.builder()
                                                                .setName(request.description())
                                                                .build()
                                                )
                                                .build()
                                )
                                .build()
                )
                .build();

        try {
            Session session = client("create_payment").checkout().sessions().create(params);
            log.info("Created Stripe Checkout session id={} for invoice={} amount={} {}",
                    session.getId(), invoiceId, request.amount(), request.currency());
            return new GatewayCheckout(session.getId(), session.getUrl());
        } catch (StripeException e) {
            throw classify("create_payment", e);
        }
    }

    @Override
    public GatewayVerification verifyPayment(UUID invoiceId, String externalRef) {
        final Session session;
        try {
            session = client("verify_payment").checkout().sessions().retrieve(externalRef);
        } catch (StripeException e) {
            throw classify("verify_payment", e);
        }

        String sessionInvoice = invoiceOf(session);
        if (!invoiceId.toString().equals(sessionInvoice)) {
            log.warn("Stripe session {} belongs to invoice {} not {}", externalRef, sessionInvoice, invoiceId);
            return new GatewayVerification(false, 0L, "Checkout session does not belong to this invoice");
        }

        boolean complete = "complete".equals(session.getStatus());
        long amount = session.getAmountTotal() != null ? session.getAmountTotal() : 0L;
        // delayed payment methods finish checkout before the funds arrive
        if (complete && "unpaid".equals(session.getPaymentStatus())) {
            return GatewayVerification.awaitingSettlement(amount,
                    "Checkout complete; waiting for the payment to settle");
        }
        boolean paid = complete && "paid".equals(session.getPaymentStatus());
        String message = paid
                ? "Payment confirmed"
                : "Checkout session status=" + session.getStatus() + " payment_status=" + session.getPaymentStatus();
        return new GatewayVerification(paid, amount, message);
    }

    public static String invoiceOf(Session session) {
        Map<String, String> metadata = session.getMetadata();
        if (metadata != null && StringUtils.hasText(metadata.get(INVOICE_METADATA_KEY))) {
            return metadata.get(INVOICE_METADATA_KEY);
        }
        return session.getClientReferenceId();
    }

    private StripeClient client(String operation) {
        if (stripeClient == null) {
            throw new GatewayUnavailableException("Stripe " + operation + " failed: no secret key configured", null);
        }
        return stripeClient;
    }

    private String successUrl(String invoiceId) {
        String url = redirectUrl(stripeProperties.getSuccessUrl(), invoiceId);
        if (StringUtils.hasText(url) && !url.contains("{CHECKOUT_SESSION_ID}")) {
            url = url + (url.contains("?") ? "&" : "?") + "session_id={CHECKOUT_SESSION_ID}";
        }
        return url;
    }

    private String redirectUrl(String template, String invoiceId) {
        if (!StringUtils.hasText(template)) {
            throw new IllegalStateException("Stripe redirect URLs are not configured");
        }
        return template.replace(INVOICE_PLACEHOLDER, invoiceId);
    }

    private PaymentGatewayException classify(String operation, StripeException e) {
        Integer status = e.getStatusCode();
        boolean transientFailure = e instanceof ApiConnectionException
                || e instanceof RateLimitException
                || e instanceof ApiException
                || (status != null && status >= 500);
        String message = "Stripe " + operation + " failed: " + e.getMessage();
        if (transientFailure) {
            return new RecoverableGatewayException(message, e);
        }
        return new TerminalGatewayException(message, e);
    }
}
