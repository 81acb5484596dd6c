package com.supperclub.common.config;

import com.supperclub.common.event.Topics;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;

import java.util.ArrayList;
import java.util.List;

/**
 * Declares the reservation topics so {@link KafkaAdmin} creates them on startup.
 * Only activates when spring.kafka.bootstrap-servers is configured.
 */
@AutoConfiguration
@ConditionalOnClass(KafkaAdmin.class)
@ConditionalOnProperty(name = "spring.kafka.bootstrap-servers")
public class KafkaTopicConfig {

    private static final short REPLICATION_FACTOR = 1;

    @Bean
    public KafkaAdmin.NewTopics reservationTopics() {
        return new KafkaAdmin.NewTopics(declaredTopics().toArray(NewTopic[]::new));
    }

    static List<NewTopic> declaredTopics() {
        List<NewTopic> topics = new ArrayList<>();
        for (String topic : Topics.BOOKING_LIFECYCLE) {
            topics.add(topic(topic, Topics.PARTITIONS_BOOKING));
            if (Topics.hasDeadLetter(topic)) {
                topics.add(topic(Topics.dlt(topic), Topics.PARTITIONS_BOOKING));
            }
        }
        topics.add(topic(Topics.ADMIN_ALERT, Topics.PARTITIONS_ADMIN));
        return topics;
    }

    private static NewTopic topic(String name, int partitions) {
        return TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(REPLICATION_FACTOR)
                .build();
    }
}
