package com.flagship.margin_ledger.config;

import com.flagship.margin_ledger.external.ExternalLedgerProperties;
import com.flagship.margin_ledger.margin.MarginProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Typed properties, scheduling and the clock used for hold expiry and timestamps.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties({MarginProperties.class, ExternalLedgerProperties.class})
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
