package com.example.triangle.config;

import com.example.triangle.event.ChatMessageEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

@Configuration
@ConditionalOnProperty(prefix = "chat.kafka", name = "enabled", havingValue = "true")
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, ChatMessageEvent> chatMessageProducerFactory(
            KafkaProperties properties, ObjectMapper objectMapper) {
        return new DefaultKafkaProducerFactory<>(
                properties.buildProducerProperties(null),
                new StringSerializer(),
                new JsonSerializer<>(objectMapper));
    }

    @Bean
    public KafkaTemplate<String, ChatMessageEvent> chatMessageKafkaTemplate(
            ProducerFactory<String, ChatMessageEvent> chatMessageProducerFactory) {
        return new KafkaTemplate<>(chatMessageProducerFactory);
    }

    @Bean
    public NewTopic messageTopic(ChatProperties chatProperties) {
        return TopicBuilder.name(chatProperties.getKafka().getMessageTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }
}
