package uk.gegc.creditledger.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.creditledger.features.billing.application.SubscriptionTierService;

@Slf4j
@Component
@RequiredArgsConstructor
public class SubscriptionExpirySweeper {

    private final SubscriptionTierService subscriptionTierService;

    @Scheduled(fixedDelayString = "#{@billingProperties.subscriptionSweeperMs}")
    public void sweep() {
        try {
            int reverted = subscriptionTierService.revertLapsedSubscriptions();
            if (reverted > 0) {
                log.info("Reverted {} lapsed subscriptions to the free tier", reverted);
            }
        } catch (RuntimeException e) {
            log.error("Subscription expiry sweep failed: {}", e.getMessage(), e);
        }
    }
}
