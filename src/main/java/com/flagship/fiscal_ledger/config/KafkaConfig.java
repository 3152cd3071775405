package com.flagship.fiscal_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to. Created on startup if missing.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.fiscal-periods:fiscal-periods}")
    private String fiscalPeriodsTopic;

    @Value("${kafka.topic.journal-entries:journal-entries}")
    private String journalEntriesTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic fiscalPeriodsTopic() {
        return TopicBuilder.name(fiscalPeriodsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic journalEntriesTopic() {
        return TopicBuilder.name(journalEntriesTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
