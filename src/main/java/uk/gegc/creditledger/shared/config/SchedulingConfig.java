package uk.gegc.creditledger.shared.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the background sweepers and the weekly ledger audit.
 * Switched off in tests so jobs never race with assertions.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "billing.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
