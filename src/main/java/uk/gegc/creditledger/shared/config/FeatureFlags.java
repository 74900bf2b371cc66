package uk.gegc.creditledger.shared.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for feature flags
 */
@Component
@ConfigurationProperties(prefix = "creditledger.features")
public class FeatureFlags {

    private boolean billing = true;

    public boolean isBilling() {
        return billing;
    }

    public void setBilling(boolean billing) {
        this.billing = billing;
    }
}
