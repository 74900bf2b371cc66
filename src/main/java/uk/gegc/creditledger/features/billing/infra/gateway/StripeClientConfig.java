package uk.gegc.creditledger.features.billing.infra.gateway;

import com.stripe.StripeClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.creditledger.features.billing.application.StripeProperties;

/**
 * Exposes the Stripe client used by {@link StripePaymentGateway}.
 * Without a secret key no client exists and every gateway call fails as unavailable.
 */
@Slf4j
@Configuration
public class StripeClientConfig {

    @Bean
    @ConditionalOnExpression("'${stripe.secret-key:}' != ''")
    public StripeClient stripeClient(StripeProperties stripe) {
        log.info("Stripe client configured in {} mode", stripe.getSecretKey().startsWith("sk_live_") ? "live" : "test");
        return new StripeClient(stripe.getSecretKey());
    }
}
