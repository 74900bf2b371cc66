package uk.gegc.creditledger.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * The one clock behind ledger timestamps, session expiry and proration.
 * Stored {@code LocalDateTime} columns are in this zone, so it must not change once data exists.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock ledgerClock(@Value("${app.timezone:UTC}") String timezone) {
        ZoneId zone = StringUtils.hasText(timezone) ? ZoneId.of(timezone.trim()) : ZoneOffset.UTC;
        return Clock.system(zone);
    }
}
