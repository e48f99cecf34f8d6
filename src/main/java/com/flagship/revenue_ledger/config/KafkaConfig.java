package com.flagship.revenue_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to. Created on startup if missing.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.journal-entries:ledger.journal-entries}")
    private String journalEntriesTopic;

    @Value("${kafka.topic.contracts:ledger.contracts}")
    private String contractsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic journalEntriesTopic() {
        return TopicBuilder.name(journalEntriesTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic contractsTopic() {
        return TopicBuilder.name(contractsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
