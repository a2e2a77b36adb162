package restopm.billing.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wall clock in the restaurant's fiscal time zone; credit note deadlines are computed against it.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock billingClock(@Value("${restopm.billing.zone:America/Guayaquil}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
