package uk.gegc.creditledger.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.creditledger.features.billing.application.PaymentSessionService;

@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentSessionExpirySweeper {

    private final PaymentSessionService paymentSessionService;

    @Scheduled(fixedDelayString = "#{@billingProperties.sessionSweeperMs}")
    public void sweep() {
        try {
            int expired = paymentSessionService.expireStaleSessions();
            if (expired > 0) {
                log.info("Expired {} stale payment sessions", expired);
            }
        } catch (RuntimeException e) {
            log.error("Payment session expiry sweep failed: {}", e.getMessage(), e);
        }
    }
}
