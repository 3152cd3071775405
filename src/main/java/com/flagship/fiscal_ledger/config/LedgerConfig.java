package com.flagship.fiscal_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Infrastructure shared by the ledger services: the clock used for "today"
 * and lifecycle timestamps, retry support for counter increments, and scheduling
 * for the outbox publisher and metrics refresh.
 */
@Configuration
@EnableRetry
@EnableScheduling
public class LedgerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
