package com.flagship.swap_coordinator.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics used by the coordinator.
 *
 * - swap-session-events: outbox facts about sessions, keyed by session id
 * - ledger-events: raw escrow events and head updates consumed in
 *   subscription mode, keyed by chain id
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.session-events:swap-session-events}")
    private String sessionEventsTopic;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Bean
    public NewTopic sessionEventsTopic() {
        return TopicBuilder.name(sessionEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    /**
     * One partition per ledger keeps head updates and escrow events of a
     * chain in order.
     */
    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(2)
                .replicas(1)
                .build();
    }
}
