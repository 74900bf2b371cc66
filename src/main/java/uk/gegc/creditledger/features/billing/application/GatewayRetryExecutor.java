package uk.gegc.creditledger.features.billing.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.creditledger.features.billing.domain.exception.GatewayUnavailableException;
import uk.gegc.creditledger.features.billing.domain.exception.RecoverableGatewayException;
import uk.gegc.creditledger.features.billing.domain.exception.TerminalGatewayException;

import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff for gateway calls. Only recoverable failures are retried;
 * terminal ones propagate immediately. Callers must not hold database locks while calling this.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayRetryExecutor {

    private final BillingProperties billingProperties;
    private final BillingMetricsService metricsService;

    public <T> T execute(String operation, Supplier<T> call) {
        int maxAttempts = billingProperties.getGateway().getMaxAttempts();
        long backoffMs = billingProperties.getGateway().getBackoffMs();

        RecoverableGatewayException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long start = System.currentTimeMillis();
            try {
                T result = call.get();
                metricsService.recordGatewayLatency(operation, System.currentTimeMillis() - start);
                return result;
            } catch (RecoverableGatewayException e) {
                lastFailure = e;
                metricsService.incrementGatewayFailure(operation, true);
                if (attempt < maxAttempts) {
                    long delay = backoffMs * (1L << (attempt - 1));
                    log.warn("Gateway {} failed (attempt {}/{}), retrying in {} ms: {}",
                            operation, attempt, maxAttempts, delay, e.getMessage());
                    metricsService.incrementGatewayRetry(operation);
                    pause(operation, delay);
                }
            } catch (TerminalGatewayException e) {
                metricsService.incrementGatewayFailure(operation, false);
                log.warn("Gateway {} rejected the request: {}", operation, e.getMessage());
                throw e;
            }
        }

        log.error("Gateway {} unavailable after {} attempts", operation, maxAttempts);
        throw new GatewayUnavailableException(
                "Payment gateway unavailable, please try again later", lastFailure);
    }

    private void pause(String operation, long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayUnavailableException("Interrupted while retrying gateway " + operation, e);
        }
    }
}
