package com.example.triangle.service;

import com.example.triangle.broadcast.ChannelBroadcaster;
import com.example.triangle.broadcast.ChannelSubscription;
import com.example.triangle.broadcast.MailboxSubscription;
import com.example.triangle.config.ChatProperties;
import com.example.triangle.domain.Channel;
import com.example.triangle.domain.ChatMessage;
import com.example.triangle.domain.MessageQuery;
import com.example.triangle.domain.MessageType;
import com.example.triangle.domain.ParticipantRoster;
import com.example.triangle.domain.ReadPosition;
import com.example.triangle.event.ChatEventListener;
import com.example.triangle.event.ChatEventPublisher;
import com.example.triangle.event.ChatEventType;
import com.example.triangle.event.ChatMessageEvent;
import com.example.triangle.service.exception.ChannelNotFoundException;
import com.example.triangle.service.exception.MessageNotFoundException;
import com.example.triangle.service.exception.SenderNotInChannelException;
import com.example.triangle.service.exception.ValidationException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for sending, reading and tracking messages on the roster's channels.
 *
 * <p>Every operation accepts a channel handle: a canonical name such as {@code dm:alice-bob} or a shorthand such as
 * {@code group} or {@code dm_bob_alice}. A sent message is committed before it is published, so subscribers never
 * observe a message that is not yet durable. None of the operations retry internally; retrying
 * {@link #sendMessage} appends a second message.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

    private final ChannelStore channelStore;
    private final ChannelNaming channelNaming;
    private final ParticipantRoster roster;
    private final ChannelBroadcaster broadcaster;
    private final ChatEventPublisher eventPublisher;
    private final ChatProperties chatProperties;
    private final Clock clock;

    public List<Channel> listChannels() {
        return channelStore.listChannels();
    }

    public List<Channel> listChannelsFor(String participant) {
        requireRosterParticipant(participant);
        return channelStore.listChannelsFor(participant);
    }

    public Channel getChannel(String channelHandle) {
        String channelName = channelNaming.resolve(channelHandle);
        return channelStore.findChannel(channelName)
                .orElseThrow(() -> new ChannelNotFoundException(channelName));
    }

    public ChatMessage sendMessage(String channelHandle, String sender, String content) {
        return sendMessage(channelHandle, sender, content, MessageType.TEXT, Map.of());
    }

    public ChatMessage sendMessage(
            String channelHandle, String sender, String content, MessageType type, Map<String, Object> metadata) {
        Channel channel = getChannel(channelHandle);
        if (!channel.hasParticipant(sender)) {
            throw new SenderNotInChannelException(sender, channel.getName());
        }
        return append(channel, sender, content, type, metadata);
    }

    /**
     * Posts a notice as the reserved {@value ParticipantRoster#SYSTEM_SENDER} sender. That sender belongs to no
     * channel and is exempt from the membership check.
     */
    public ChatMessage broadcastSystem(String channelHandle, String content) {
        Channel channel = getChannel(channelHandle);
        return append(channel, ParticipantRoster.SYSTEM_SENDER, content, MessageType.SYSTEM, Map.of());
    }

    public List<ChatMessage> getMessages(String channelHandle) {
        return getMessages(channelHandle, MessageQuery.defaults());
    }

    public List<ChatMessage> getMessages(String channelHandle, MessageQuery query) {
        Channel channel = getChannel(channelHandle);
        MessageQuery effective = query != null ? query : MessageQuery.defaults();
        if (effective.getLimit() == null) {
            effective = effective.toBuilder()
                    .limit(chatProperties.getMessages().getDefaultPageSize())
                    .build();
        } else if (effective.getLimit() < 1) {
            throw new ValidationException("limit", "must be positive");
        }
        return channelStore.queryMessages(channel.getId(), effective);
    }

    public List<ChatMessage> getUnread(String channelHandle, String participant) {
        Channel channel = getChannel(channelHandle);
        requireChannelParticipant(channel, participant);
        ReadPosition position = channelStore.getOrCreateReadPosition(channel.getId(), participant);
        return channelStore.findMessagesAfter(channel.getId(), position.getLastReadAt());
    }

    public long unreadCount(String channelHandle, String participant) {
        Channel channel = getChannel(channelHandle);
        requireChannelParticipant(channel, participant);
        ReadPosition position = channelStore.getOrCreateReadPosition(channel.getId(), participant);
        return channelStore.countMessagesAfter(channel.getId(), position.getLastReadAt());
    }

    /**
     * Marks every message committed so far as read.
     */
    public ReadPosition markRead(String channelHandle, String participant) {
        return markRead(channelHandle, participant, null);
    }

    /**
     * Moves the participant's cursor to the given message, or to the newest committed message when
     * {@code messageId} is {@code null}. An append still in flight stays unread. The cursor never moves backward;
     * marking an older message, or an empty channel, leaves it unchanged.
     */
    public ReadPosition markRead(String channelHandle, String participant, String messageId) {
        Channel channel = getChannel(channelHandle);
        requireChannelParticipant(channel, participant);
        ChatMessage message;
        if (messageId == null) {
            Optional<ChatMessage> latest = channelStore.findLatestMessage(channel.getId());
            if (latest.isEmpty()) {
                return channelStore.getOrCreateReadPosition(channel.getId(), participant);
            }
            message = latest.get();
        } else {
            message = requireMessageInChannel(channel, messageId);
        }
        return channelStore.advanceReadPosition(channel.getId(), participant, message.getCreatedAt(), message.getId());
    }

    public ChatMessage editMessage(String channelHandle, String messageId, String content) {
        Channel channel = getChannel(channelHandle);
        requireMessageInChannel(channel, messageId);
        ChatMessage edited = channelStore.editMessage(messageId, content, now());
        publish(channel, ChatEventType.MESSAGE_EDITED, edited);
        return edited;
    }

    /**
     * Hides a message from default reads. The message keeps its place in the channel history.
     */
    public ChatMessage deleteMessage(String channelHandle, String messageId) {
        Channel channel = getChannel(channelHandle);
        ChatMessage message = requireMessageInChannel(channel, messageId);
        if (message.isDeleted()) {
            return message;
        }
        ChatMessage deleted = channelStore.softDeleteMessage(messageId);
        publish(channel, ChatEventType.MESSAGE_DELETED, deleted);
        return deleted;
    }

    /**
     * Last-read timestamps of the participant keyed by canonical channel name. Channels never read are absent.
     */
    public Map<String, Instant> getReadPositions(String participant) {
        requireRosterParticipant(participant);
        return channelStore.findReadPositions(participant);
    }

    public MailboxSubscription subscribe(String channelHandle) {
        Channel channel = getChannel(channelHandle);
        return broadcaster.subscribe(channel.getName());
    }

    public ChannelSubscription subscribe(String channelHandle, ChatEventListener listener) {
        Channel channel = getChannel(channelHandle);
        return broadcaster.subscribe(channel.getName(), listener);
    }

    public void unsubscribe(ChannelSubscription subscription) {
        broadcaster.unsubscribe(subscription);
    }

    private ChatMessage append(
            Channel channel, String sender, String content, MessageType type, Map<String, Object> metadata) {
        ChatMessage message = channelStore.insertMessage(
                channel.getId(),
                sender,
                content,
                type != null ? type : MessageType.TEXT,
                metadata != null ? metadata : Map.of());
        log.debug("Appended message {} (#{}) to channel {}", message.getId(), message.getSequence(), channel.getName());

        try {
            channelStore.touchChannel(channel.getId(), message.getCreatedAt());
        } catch (RuntimeException ex) {
            log.warn("Failed to update activity of channel {}", channel.getName(), ex);
        }

        publish(channel, ChatEventType.MESSAGE_CREATED, message);
        return message;
    }

    private void publish(Channel channel, ChatEventType type, ChatMessage message) {
        eventPublisher.publishMessageEvent(ChatMessageEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .channelName(channel.getName())
                .message(message)
                .occurredAt(now())
                .build());
    }

    private ChatMessage requireMessageInChannel(Channel channel, String messageId) {
        ChatMessage message = channelStore.findMessage(messageId)
                .orElseThrow(() -> new MessageNotFoundException(messageId));
        if (!channel.getId().equals(message.getChannelId())) {
            throw MessageNotFoundException.notInChannel(messageId, channel.getName());
        }
        return message;
    }

    private void requireChannelParticipant(Channel channel, String participant) {
        requireRosterParticipant(participant);
        if (!channel.hasParticipant(participant)) {
            throw new ValidationException("participant", "is not a member of channel " + channel.getName());
        }
    }

    private void requireRosterParticipant(String participant) {
        if (!roster.contains(participant)) {
            throw new ValidationException("participant", "is not a recognized participant: " + participant);
        }
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
