package com.flagship.inventory_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the ledger event topic. Events are keyed by aggregate id, so all
 * events of one sale, purchase or product land on the same partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.inventory-events:inventory-events}")
    private String inventoryEventsTopic;

    @Bean
    public NewTopic inventoryEventsTopic() {
        return TopicBuilder.name(inventoryEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
