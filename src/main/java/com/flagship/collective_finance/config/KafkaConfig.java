package com.flagship.collective_finance.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.notifications:collective-notifications}")
    private String notificationsTopic;

    @Value("${kafka.topic.notifications-partitions:3}")
    private int partitions;

    /**
     * Notification topic, keyed by the notified aggregate so invitations for
     * one card stay ordered.
     */
    @Bean
    public NewTopic notificationsTopic() {
        return TopicBuilder.name(notificationsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
