package uk.gegc.creditledger.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi walletGroup() {
        return GroupedOpenApi.builder()
                .group("wallet")
                .displayName("Wallet & Payments")
                .pathsToMatch("/api/v1/wallet/**", "/api/v1/payments/**")
                .build();
    }

    @Bean
    public GroupedOpenApi subscriptionsGroup() {
        return GroupedOpenApi.builder()
                .group("subscriptions")
                .displayName("Subscription Tiers")
                .pathsToMatch("/api/v1/subscription-tiers/**", "/api/v1/purchase/**")
                .build();
    }

    @Bean
    public GroupedOpenApi adminGroup() {
        return GroupedOpenApi.builder()
                .group("admin")
                .displayName("Billing Administration")
                .pathsToMatch("/api/v1/admin/**")
                .build();
    }
}
