package uk.gegc.creditledger.features.billing.api;

import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.creditledger.features.billing.application.StripeWebhookService;
import uk.gegc.creditledger.shared.config.FeatureFlags;

@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class StripeWebhookController {

    private final StripeWebhookService webhookService;
    private final FeatureFlags featureFlags;

    @Hidden // called by Stripe only
    @PostMapping("/stripe/webhook")
    public ResponseEntity<String> handleStripeWebhook(
            @Parameter(hidden = true) @RequestBody String payload,
            @RequestHeader(name = "Stripe-Signature", required = false) String sigHeader) {
        if (!featureFlags.isBilling()) {
            log.warn("Billing feature is disabled, rejecting webhook");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("");
        }

        var res = webhookService.process(payload, sigHeader);
        log.debug("Stripe webhook handled with result {}", res);
        return ResponseEntity.ok("");
    }
}
