package uk.gegc.creditledger.features.billing.application.impl;

import com.stripe.exception.EventDataObjectDeserializationException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.model.Event;
import com.stripe.model.EventDataObjectDeserializer;
import com.stripe.model.StripeObject;
import com.stripe.model.checkout.Session;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.creditledger.features.billing.api.dto.VerifyPaymentResponse;
import uk.gegc.creditledger.features.billing.application.BillingMetricsService;
import uk.gegc.creditledger.features.billing.application.ReconciliationService;
import uk.gegc.creditledger.features.billing.application.StripeProperties;
import uk.gegc.creditledger.features.billing.application.StripeWebhookService;
import uk.gegc.creditledger.features.billing.domain.exception.SessionExpiredException;
import uk.gegc.creditledger.features.billing.domain.exception.SessionMismatchException;
import uk.gegc.creditledger.features.billing.domain.exception.WebhookInvalidSignatureException;
import uk.gegc.creditledger.features.billing.infra.gateway.StripePaymentGateway;

import java.util.UUID;

/**
 * Server-to-server confirmation path. Stripe delivers at least once, so every event is fed through the same
 * idempotent reconciliation as the browser redirect.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StripeWebhookServiceImpl implements StripeWebhookService {

    private final StripeProperties stripeProperties;
    private final ReconciliationService reconciliationService;
    private final BillingMetricsService metricsService;

    @Override
    public Result process(String payload, String signatureHeader) {
        String webhookSecret = stripeProperties.getWebhookSecret();
        if (!StringUtils.hasText(webhookSecret)) {
            log.warn("Stripe webhook secret not configured; rejecting request");
            throw new WebhookInvalidSignatureException("Webhook secret not configured");
        }

        final Event event;
        try {
            event = Webhook.constructEvent(payload, signatureHeader, webhookSecret);
        } catch (SignatureVerificationException e) {
            log.warn("Stripe webhook signature verification failed: {}", e.getMessage());
            throw new WebhookInvalidSignatureException("Invalid Stripe signature");
        }

        String type = event.getType();
        metricsService.incrementWebhookReceived(type);
        log.info("Processing Stripe webhook event: id={} type={}", event.getId(), type);

        return switch (type) {
            case "checkout.session.completed" -> handleCompleted(event);
            case "checkout.session.async_payment_succeeded" -> reconcile(event, checkoutSession(event), "success");
            case "checkout.session.async_payment_failed" -> reconcile(event, checkoutSession(event), "failed");
            case "checkout.session.expired" -> reconcile(event, checkoutSession(event), "expired");
            default -> {
                log.info("Ignoring Stripe event id={} type={} (not handled)", event.getId(), type);
                yield Result.IGNORED;
            }
        };
    }

    private Result handleCompleted(Event event) {
        Session session = checkoutSession(event);
        // delayed payment methods complete checkout before the money arrives
        if (session != null && "unpaid".equals(session.getPaymentStatus())) {
            log.info("Checkout session {} completed but unpaid; waiting for async payment event", session.getId());
            return Result.IGNORED;
        }
        return reconcile(event, session, "success");
    }

    private Result reconcile(Event event, Session session, String gatewayStatus) {
        String externalRef = session != null ? session.getId() : null;
        UUID invoiceId = session != null ? invoiceId(StripePaymentGateway.invoiceOf(session)) : null;
        if (externalRef == null || invoiceId == null) {
            log.warn("Stripe event {} carries no invoice reference; ignoring", event.getId());
            return Result.IGNORED;
        }

        try {
            VerifyPaymentResponse response = reconciliationService.reconcile(
                    new ReconciliationService.PaymentCallback(invoiceId, externalRef, gatewayStatus), null);
            return response.alreadyProcessed() ? Result.DUPLICATE : Result.OK;
        } catch (SessionMismatchException e) {
            log.warn("Stripe event {} does not match a payment session (invoice {}); ignoring",
                    event.getId(), invoiceId);
            return Result.IGNORED;
        } catch (SessionExpiredException e) {
            log.info("Stripe event {} refers to expired session {}", event.getId(), invoiceId);
            return Result.OK;
        }
    }

    /**
     * The event's Checkout Session. Events pinned to another API version are deserialized leniently.
     */
    private Session checkoutSession(Event event) {
        EventDataObjectDeserializer dataObjectDeserializer = event.getDataObjectDeserializer();
        StripeObject stripeObject;
        if (dataObjectDeserializer.getObject().isPresent()) {
            stripeObject = dataObjectDeserializer.getObject().get();
        } else {
            log.debug("Stripe event {} has API version {}; deserializing leniently", event.getId(), event.getApiVersion());
            try {
                stripeObject = dataObjectDeserializer.deserializeUnsafe();
            } catch (EventDataObjectDeserializationException e) {
                throw new IllegalArgumentException("Malformed Stripe event payload", e);
            }
        }
        if (stripeObject instanceof Session session) {
            return session;
        }
        log.warn("Stripe event {} carries {} instead of a checkout session", event.getId(),
                stripeObject != null ? stripeObject.getClass().getSimpleName() : "nothing");
        return null;
    }

    private static UUID invoiceId(String raw) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed invoice reference '{}': {}", raw, e.getMessage());
            return null;
        }
    }
}
