package com.example.triangle.persistence;

import com.example.triangle.domain.Channel;
import com.example.triangle.domain.ChatMessage;
import com.example.triangle.domain.ReadPosition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@RequiredArgsConstructor
public class ChatEntityMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public Channel toChannel(ChannelEntity entity) {
        if (entity == null) {
            return null;
        }
        return Channel.builder()
                .id(entity.getId())
                .name(entity.getName())
                .type(entity.getChannelType())
                .participants(readList(entity.getParticipants()))
                .description(entity.getDescription())
                .lastActivityAt(entity.getLastActivityAt())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public ChatMessage toMessage(MessageEntity entity) {
        if (entity == null) {
            return null;
        }
        return ChatMessage.builder()
                .id(entity.getId())
                .channelId(entity.getChannel().getId())
                .sequence(entity.getSequence())
                .sender(entity.getSender())
                .type(entity.getMessageType())
                .content(entity.getContent())
                .metadata(readMap(entity.getMetadata()))
                .deleted(entity.isDeleted())
                .editedAt(entity.getEditedAt())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public ReadPosition toReadPosition(ReadPositionEntity entity) {
        if (entity == null) {
            return null;
        }
        return ReadPosition.builder()
                .id(entity.getId())
                .channelId(entity.getChannel().getId())
                .participant(entity.getParticipant())
                .lastReadAt(entity.getLastReadAt())
                .lastReadMessageId(entity.getLastReadMessageId())
                .build();
    }

    public String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map && map.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize value", e);
        }
    }

    private Map<String, Object> readMap(String json) {
        if (!StringUtils.hasText(json)) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored message metadata is not valid JSON", e);
        }
    }

    private List<String> readList(String json) {
        if (!StringUtils.hasText(json)) {
            return Collections.emptyList();
        }
        try {
            return List.copyOf(objectMapper.readValue(json, LIST_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored channel participants are not valid JSON", e);
        }
    }
}
