package com.gbce.config;

import com.gbce.exchange.Exchange;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the exchange and its clock from application.properties.
 *
 * <p>The clock is a bean of its own so trade timestamps and window cutoffs can be
 * driven by a controllable clock in tests.
 *
 * <p>Properties prefix: {@code gbce.*}
 */
@Configuration
public class ExchangeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Exchange exchange(Clock clock, @Value("${gbce.vwsp.window-minutes:5}") long vwspWindowMinutes) {
        return new Exchange(clock, Duration.ofMinutes(vwspWindowMinutes));
    }
}
