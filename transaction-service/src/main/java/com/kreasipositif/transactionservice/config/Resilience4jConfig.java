package com.kreasipositif.transactionservice.config;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j bulkhead configuration.
 *
 * <p>Fraud summaries score every visible transaction against the whole visible set, which
 * is the most CPU-hungry operation in the service. A <b>SemaphoreBulkhead</b> caps how many
 * of those scans may run at the same time; with the default zero wait, callers beyond
 * {@code maxConcurrentCalls} are rejected instead of queued.
 *
 * <p>Values are read from {@code application.yml} under {@code resilience4j.bulkhead.*}.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    @Value("${resilience4j.bulkhead.instances.fraudScoringBulkhead.max-concurrent-calls:4}")
    private int fraudScoringMaxConcurrent;

    @Value("${resilience4j.bulkhead.instances.fraudScoringBulkhead.max-wait-duration:0ms}")
    private Duration fraudScoringMaxWait;

    @Bean("fraudScoringBulkhead")
    public Bulkhead fraudScoringBulkhead(BulkheadRegistry registry) {
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(fraudScoringMaxConcurrent)
                .maxWaitDuration(fraudScoringMaxWait)
                .build();
        Bulkhead bh = registry.bulkhead("fraudScoringBulkhead", cfg);
        log.info("SemaphoreBulkhead 'fraudScoringBulkhead' created: maxConcurrent={}, maxWait={}",
                fraudScoringMaxConcurrent, fraudScoringMaxWait);
        return bh;
    }

    @Bean
    public BulkheadRegistry bulkheadRegistry() {
        return BulkheadRegistry.ofDefaults();
    }
}
