package com.example.triangle.event;

import com.example.triangle.broadcast.ChannelBroadcaster;
import com.example.triangle.config.ChatProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Hands persisted message events to live subscribers and, when enabled, mirrors them to Kafka.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatEventPublisher {

    private final ChannelBroadcaster broadcaster;
    private final ObjectProvider<KafkaTemplate<String, ChatMessageEvent>> chatMessageKafkaTemplate;
    private final ChatProperties chatProperties;

    public void publishMessageEvent(ChatMessageEvent event) {
        broadcaster.publish(event.getChannelName(), event);
        if (chatProperties.getKafka().isEnabled()) {
            mirrorToKafka(event);
        }
    }

    private void mirrorToKafka(ChatMessageEvent event) {
        KafkaTemplate<String, ChatMessageEvent> template = chatMessageKafkaTemplate.getIfAvailable();
        if (template == null) {
            log.warn("Kafka mirroring is enabled but no message template is configured");
            return;
        }
        String topic = chatProperties.getKafka().getMessageTopic();
        template.send(topic, event.getChannelName(), event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to mirror event {} for channel {} to Kafka",
                                event.getEventId(), event.getChannelName(), ex);
                    }
                });
    }
}
