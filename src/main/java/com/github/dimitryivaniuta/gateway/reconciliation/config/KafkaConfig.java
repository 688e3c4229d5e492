package com.github.dimitryivaniuta.gateway.reconciliation.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic configuration.
 */
@Configuration
public class KafkaConfig {

    /**
     * Topic receiving settled and classified webhook events from the outbox.
     *
     * <p>Partitioned by order/cart id, so events of one order keep their relative order.</p>
     *
     * @param props application properties
     * @return topic definition
     */
    @Bean
    public NewTopic webhookEventsTopic(AppProperties props) {
        return TopicBuilder.name(props.getOutbox().getWebhookEventsTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }
}
