package com.example.triangle.websocket;

import com.corundumstudio.socketio.AckRequest;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.triangle.broadcast.ChannelSubscription;
import com.example.triangle.domain.Channel;
import com.example.triangle.domain.ChatMessage;
import com.example.triangle.domain.MessageType;
import com.example.triangle.domain.ParticipantRoster;
import com.example.triangle.domain.ReadPosition;
import com.example.triangle.dto.ChatMessagePayload;
import com.example.triangle.dto.ReadPayload;
import com.example.triangle.dto.SocketHandshakeResponse;
import com.example.triangle.service.ChatService;
import com.example.triangle.service.exception.ValidationException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Live transport for browsers. A client connects with {@code participant} and an optional comma separated
 * {@code channels} list of handles; without one it joins every channel the participant belongs to.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "chat.socketio", name = "enabled", havingValue = "true")
public class SocketIoChannelGateway {

    static final String MESSAGE_EVENT = "chat:message";
    static final String READ_EVENT = "chat:read";
    static final String SYSTEM_EVENT = "system:event";
    static final String ERROR_EVENT = "system:error";

    static final String PARAM_PARTICIPANT = "participant";
    static final String PARAM_CHANNELS = "channels";

    static final String ATTR_PARTICIPANT = "participant";
    static final String ATTR_SUBSCRIPTIONS = "subscriptions";

    private final SocketIOServer socketIOServer;
    private final ChatService chatService;
    private final ParticipantRoster roster;

    @PostConstruct
    public void registerListeners() {
        socketIOServer.addConnectListener(this::handleConnect);
        socketIOServer.addDisconnectListener(this::handleDisconnect);
        socketIOServer.addEventListener(MESSAGE_EVENT, ChatMessagePayload.class, this::handleMessage);
        socketIOServer.addEventListener(READ_EVENT, ReadPayload.class, this::handleRead);
    }

    void handleConnect(SocketIOClient client) {
        List<ChannelSubscription> subscriptions = new ArrayList<>();
        try {
            String participant = client.getHandshakeData().getSingleUrlParam(PARAM_PARTICIPANT);
            if (!roster.contains(participant)) {
                throw new ValidationException("participant", "is not a recognized participant: " + participant);
            }

            List<Channel> channels = resolveChannels(participant, client.getHandshakeData().getSingleUrlParam(PARAM_CHANNELS));
            for (Channel channel : channels) {
                subscriptions.add(chatService.subscribe(channel.getName(),
                        event -> client.sendEvent(MESSAGE_EVENT, event)));
            }
            client.set(ATTR_PARTICIPANT, participant);
            client.set(ATTR_SUBSCRIPTIONS, subscriptions);

            client.sendEvent(SYSTEM_EVENT, SocketHandshakeResponse.builder()
                    .participant(participant)
                    .channels(channels.stream().map(Channel::getName).toList())
                    .build());
            log.info("Client {} connected as {} to {} channel(s)", client.getSessionId(), participant, channels.size());
        } catch (Exception e) {
            log.error("Failed to handle connect", e);
            subscriptions.forEach(chatService::unsubscribe);
            client.sendEvent(ERROR_EVENT, Map.of("message", String.valueOf(e.getMessage())));
            client.disconnect();
        }
    }

    private List<Channel> resolveChannels(String participant, String channelsParam) {
        if (!StringUtils.hasText(channelsParam)) {
            return chatService.listChannelsFor(participant);
        }
        List<Channel> channels = new ArrayList<>();
        for (String handle : Arrays.stream(channelsParam.split(",")).map(String::trim).filter(StringUtils::hasText).toList()) {
            Channel channel = chatService.getChannel(handle);
            if (!channel.hasParticipant(participant)) {
                throw new ValidationException("channels", participant + " is not a member of " + channel.getName());
            }
            channels.add(channel);
        }
        return channels;
    }

    void handleDisconnect(SocketIOClient client) {
        List<ChannelSubscription> subscriptions = client.get(ATTR_SUBSCRIPTIONS);
        if (subscriptions != null) {
            subscriptions.forEach(chatService::unsubscribe);
            client.del(ATTR_SUBSCRIPTIONS);
        }
        String participant = client.get(ATTR_PARTICIPANT);
        if (participant != null) {
            log.info("Client {} ({}) disconnected", client.getSessionId(), participant);
        }
    }

    void handleMessage(SocketIOClient client, ChatMessagePayload payload, AckRequest ackSender) {
        String sender = client.get(ATTR_PARTICIPANT);
        if (sender == null) {
            client.disconnect();
            return;
        }

        try {
            MessageType type = StringUtils.hasText(payload.getType())
                    ? MessageType.fromValue(payload.getType())
                            .orElseThrow(() -> new ValidationException("type", "unsupported message type: " + payload.getType()))
                    : MessageType.TEXT;
            ChatMessage message = chatService.sendMessage(payload.getChannel(), sender, payload.getContent(), type, Map.of());
            if (ackSender != null && ackSender.isAckRequested()) {
                ackSender.sendAckData(message);
            }
        } catch (Exception ex) {
            log.error("Failed to send message from {} to {}", sender, payload.getChannel(), ex);
            if (ackSender != null && ackSender.isAckRequested()) {
                ackSender.sendAckData(Map.of("error", String.valueOf(ex.getMessage())));
            }
        }
    }

    void handleRead(SocketIOClient client, ReadPayload payload, AckRequest ackSender) {
        String participant = client.get(ATTR_PARTICIPANT);
        if (participant == null) {
            client.disconnect();
            return;
        }

        try {
            ReadPosition position = chatService.markRead(payload.getChannel(), participant, payload.getMessageId());
            if (ackSender != null && ackSender.isAckRequested()) {
                ackSender.sendAckData(position);
            }
        } catch (Exception ex) {
            log.error("Failed to mark {} read for {}", payload.getChannel(), participant, ex);
            if (ackSender != null && ackSender.isAckRequested()) {
                ackSender.sendAckData(Map.of("error", String.valueOf(ex.getMessage())));
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        socketIOServer.removeAllListeners(MESSAGE_EVENT);
        socketIOServer.removeAllListeners(READ_EVENT);
    }
}
