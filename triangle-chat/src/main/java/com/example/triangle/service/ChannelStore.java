package com.example.triangle.service;

import com.example.triangle.domain.Channel;
import com.example.triangle.domain.ChatMessage;
import com.example.triangle.domain.MessageQuery;
import com.example.triangle.domain.MessageType;
import com.example.triangle.domain.ReadPosition;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable storage for channels, their messages and the participants' read positions.
 */
public interface ChannelStore {

    Optional<Channel> findChannel(String name);

    /**
     * All channels ordered by name.
     */
    List<Channel> listChannels();

    /**
     * Channels the participant belongs to, most recently active first.
     */
    List<Channel> listChannelsFor(String participant);

    /**
     * @throws com.example.triangle.service.exception.AlreadyExistsException if the name is taken
     */
    Channel createChannel(Channel channel);

    /**
     * Best-effort activity stamp; concurrent updates are last-write-wins.
     */
    void touchChannel(String channelId, Instant activityAt);

    /**
     * Appends a message. Appends to one channel are serialized and each receives the next sequence number.
     *
     * @throws com.example.triangle.service.exception.ValidationException if sender, content or type are invalid
     */
    ChatMessage insertMessage(
            String channelId, String sender, String content, MessageType type, Map<String, Object> metadata);

    Optional<ChatMessage> findMessage(String messageId);

    /**
     * Messages matching the query, oldest first.
     */
    List<ChatMessage> queryMessages(String channelId, MessageQuery query);

    /**
     * Non-deleted messages created strictly after {@code since}, or all of them when {@code since} is {@code null}.
     */
    List<ChatMessage> findMessagesAfter(String channelId, Instant since);

    long countMessagesAfter(String channelId, Instant since);

    /**
     * The newest committed, non-deleted message of the channel.
     */
    Optional<ChatMessage> findLatestMessage(String channelId);

    ChatMessage editMessage(String messageId, String content, Instant editedAt);

    ChatMessage softDeleteMessage(String messageId);

    /**
     * Returns the participant's read position, creating an empty one when none exists yet.
     */
    ReadPosition getOrCreateReadPosition(String channelId, String participant);

    /**
     * Moves the cursor to {@code readAt} unless it already points at or past it.
     *
     * @return the read position after the update
     */
    ReadPosition advanceReadPosition(String channelId, String participant, Instant readAt, String messageId);

    /**
     * Last-read timestamps of the participant keyed by channel name.
     */
    Map<String, Instant> findReadPositions(String participant);
}
