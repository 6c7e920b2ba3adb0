package com.example.triangle.service;

import com.example.triangle.TickingClockConfig;
import com.example.triangle.broadcast.MailboxSubscription;
import com.example.triangle.domain.Channel;
import com.example.triangle.domain.ChatMessage;
import com.example.triangle.domain.MessageQuery;
import com.example.triangle.domain.MessageType;
import com.example.triangle.domain.ReadPosition;
import com.example.triangle.event.ChatEventType;
import com.example.triangle.event.ChatMessageEvent;
import com.example.triangle.persistence.ChannelJpaRepository;
import com.example.triangle.persistence.MessageJpaRepository;
import com.example.triangle.persistence.ReadPositionJpaRepository;
import com.example.triangle.service.exception.ChannelNotFoundException;
import com.example.triangle.service.exception.ChatErrorCode;
import com.example.triangle.service.exception.MessageNotFoundException;
import com.example.triangle.service.exception.SenderNotInChannelException;
import com.example.triangle.service.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(TickingClockConfig.class)
class ChatServiceTest {

    @Autowired
    private ChatService chatService;

    @Autowired
    private ChannelSeeder channelSeeder;

    @Autowired
    private ChannelStore channelStore;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private ChannelJpaRepository channelRepository;

    @Autowired
    private MessageJpaRepository messageRepository;

    @Autowired
    private ReadPositionJpaRepository readPositionRepository;

    @BeforeEach
    void resetChannels() {
        readPositionRepository.deleteAll();
        messageRepository.deleteAll();
        var channels = channelRepository.findAll();
        channels.forEach(channel -> channel.setLastActivityAt(null));
        channelRepository.saveAll(channels);
    }

    private List<String> contents(List<ChatMessage> messages) {
        return messages.stream().map(ChatMessage::getContent).toList();
    }

    @Test
    void seededChannelsMatchTheRoster() {
        assertEquals(List.of("dm:alice-bob", "dm:alice-carol", "dm:bob-carol", "group"),
                chatService.listChannels().stream().map(Channel::getName).toList());
        assertEquals(0, channelSeeder.seed());
    }

    @Test
    void sentMessagesComeBackInOrder() {
        chatService.sendMessage("group", "alice", "one");
        chatService.sendMessage("group", "bob", "two");
        chatService.sendMessage("group", "carol", "three");

        List<ChatMessage> messages = chatService.getMessages("group");
        assertEquals(List.of("one", "two", "three"), contents(messages));
        for (int i = 1; i < messages.size(); i++) {
            assertTrue(messages.get(i - 1).getCreatedAt().isBefore(messages.get(i).getCreatedAt()));
            assertTrue(messages.get(i - 1).getSequence() < messages.get(i).getSequence());
        }
    }

    @Test
    void roundTripKeepsSenderTypeAndMetadata() {
        ChatMessage sent = chatService.sendMessage(
                "group", "alice", "System.out.println()", MessageType.CODE, Map.of("language", "java"));

        ChatMessage stored = chatService.getMessages("group").get(0);
        assertEquals(sent.getId(), stored.getId());
        assertEquals("alice", stored.getSender());
        assertEquals(MessageType.CODE, stored.getType());
        assertEquals("java", stored.getMetadata().get("language"));
        assertFalse(stored.isDeleted());
    }

    @Test
    void directHandlesAreSymmetric() {
        chatService.sendMessage("dm_alice_bob", "alice", "hi bob");
        chatService.sendMessage("dm_bob_alice", "bob", "hi alice");

        assertEquals(List.of("hi bob", "hi alice"), contents(chatService.getMessages("dm:alice-bob")));
        assertEquals(chatService.getChannel("dm_bob_alice").getId(), chatService.getChannel("dm_alice_bob").getId());
    }

    @Test
    void senderOutsideTheChannelPersistsNothing() {
        var ex = assertThrows(SenderNotInChannelException.class,
                () -> chatService.sendMessage("dm_alice_bob", "carol", "intruding"));
        assertEquals(ChatErrorCode.SENDER_NOT_IN_CHANNEL, ex.getErrorCode());
        assertTrue(chatService.getMessages("dm:alice-bob").isEmpty());
        assertEquals(0, messageRepository.count());
    }

    @Test
    void unknownChannelIsReported() {
        var ex = assertThrows(ChannelNotFoundException.class, () -> chatService.sendMessage("lobby", "alice", "x"));
        assertEquals("lobby", ex.getChannelName());
        assertThrows(ChannelNotFoundException.class, () -> chatService.getMessages("dm_alice_mallory"));
    }

    @Test
    void contentLengthBoundaries() {
        var empty = assertThrows(ValidationException.class, () -> chatService.sendMessage("group", "alice", ""));
        assertEquals("content", empty.getField());
        assertThrows(ValidationException.class, () -> chatService.sendMessage("group", "alice", "   "));
        assertThrows(ValidationException.class, () -> chatService.sendMessage("group", "alice", null));

        ChatMessage longest = chatService.sendMessage("group", "alice", "a".repeat(50_000));
        assertEquals(50_000, longest.getContent().length());

        var tooLong = assertThrows(ValidationException.class,
                () -> chatService.sendMessage("group", "alice", "a".repeat(50_001)));
        assertEquals("content", tooLong.getField());
        assertEquals(1, chatService.getMessages("group").size());
    }

    @Test
    void limitKeepsTheNewestMessagesInChronologicalOrder() {
        for (int i = 1; i <= 5; i++) {
            chatService.sendMessage("group", "alice", "m" + i);
        }
        List<ChatMessage> page = chatService.getMessages("group", MessageQuery.builder().limit(2).build());
        assertEquals(List.of("m4", "m5"), contents(page));

        assertThrows(ValidationException.class,
                () -> chatService.getMessages("group", MessageQuery.builder().limit(0).build()));
    }

    @Test
    void sinceAndBeforeAreExclusive() {
        ChatMessage first = chatService.sendMessage("group", "alice", "first");
        chatService.sendMessage("group", "bob", "second");
        ChatMessage third = chatService.sendMessage("group", "carol", "third");

        MessageQuery window = MessageQuery.builder()
                .since(first.getCreatedAt())
                .before(third.getCreatedAt())
                .build();
        assertEquals(List.of("second"), contents(chatService.getMessages("group", window)));
    }

    @Test
    void markReadIsIdempotent() {
        chatService.sendMessage("group", "alice", "one");
        chatService.sendMessage("group", "bob", "two");
        assertEquals(2, chatService.unreadCount("group", "carol"));

        chatService.markRead("group", "carol");
        assertEquals(0, chatService.unreadCount("group", "carol"));
        chatService.markRead("group", "carol");
        assertEquals(0, chatService.unreadCount("group", "carol"));
        assertTrue(chatService.getUnread("group", "carol").isEmpty());
    }

    @Test
    void markReadByMessageNeverMovesBackward() {
        ChatMessage first = chatService.sendMessage("group", "alice", "one");
        ChatMessage second = chatService.sendMessage("group", "alice", "two");
        chatService.sendMessage("group", "alice", "three");

        ReadPosition atSecond = chatService.markRead("group", "bob", second.getId());
        assertEquals(second.getCreatedAt(), atSecond.getLastReadAt());
        assertEquals(second.getId(), atSecond.getLastReadMessageId());
        assertEquals(List.of("three"), contents(chatService.getUnread("group", "bob")));

        ReadPosition unchanged = chatService.markRead("group", "bob", first.getId());
        assertEquals(second.getCreatedAt(), unchanged.getLastReadAt());
        assertEquals(second.getId(), unchanged.getLastReadMessageId());
        assertEquals(1, chatService.unreadCount("group", "bob"));
    }

    @Test
    void markReadLeavesAppendsInFlightUnread() throws Exception {
        ChatMessage committed = chatService.sendMessage("group", "alice", "committed");
        String groupId = chatService.getChannel("group").getId();
        assertEquals(1, chatService.unreadCount("group", "bob"));
        CountDownLatch inserted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService writer = Executors.newSingleThreadExecutor();
        try {
            Future<?> append = writer.submit(() -> new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
                channelStore.insertMessage(groupId, "alice", "in flight", MessageType.TEXT, Map.of());
                inserted.countDown();
                try {
                    assertTrue(release.await(10, TimeUnit.SECONDS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }));
            assertTrue(inserted.await(10, TimeUnit.SECONDS));

            assertEquals(1, chatService.unreadCount("group", "bob"));
            ReadPosition position = chatService.markRead("group", "bob");
            assertEquals(committed.getId(), position.getLastReadMessageId());
            assertEquals(committed.getCreatedAt(), position.getLastReadAt());

            release.countDown();
            append.get(10, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            writer.shutdownNow();
        }

        assertEquals(List.of("in flight"), contents(chatService.getUnread("group", "bob")));
    }

    @Test
    void markReadOnEmptyChannelKeepsCursorEmpty() {
        ReadPosition position = chatService.markRead("dm_bob_carol", "bob");
        assertNull(position.getLastReadAt());

        chatService.sendMessage("dm_bob_carol", "carol", "first");
        assertEquals(1, chatService.unreadCount("dm_bob_carol", "bob"));
    }

    @Test
    void readTrackingRequiresChannelMembership() {
        chatService.sendMessage("dm_alice_bob", "alice", "private");

        var ex = assertThrows(ValidationException.class, () -> chatService.markRead("dm_alice_bob", "carol"));
        assertEquals("participant", ex.getField());
        assertThrows(ValidationException.class, () -> chatService.unreadCount("dm_alice_bob", "carol"));
        assertThrows(ValidationException.class, () -> chatService.getUnread("dm_alice_bob", "carol"));
        assertFalse(chatService.getReadPositions("carol").containsKey("dm:alice-bob"));
    }

    @Test
    void readPositionsArePerParticipant() {
        chatService.sendMessage("group", "alice", "hello all");
        chatService.sendMessage("group", "bob", "hey");

        chatService.markRead("group", "alice");

        assertEquals(0, chatService.unreadCount("group", "alice"));
        assertEquals(2, chatService.unreadCount("group", "bob"));
        assertEquals(2, chatService.unreadCount("group", "carol"));
    }

    @Test
    void markReadRejectsUnknownAndForeignMessages() {
        ChatMessage dm = chatService.sendMessage("dm_alice_bob", "alice", "private");

        var unknown = assertThrows(MessageNotFoundException.class,
                () -> chatService.markRead("group", "alice", "no-such-message"));
        assertEquals(ChatErrorCode.MESSAGE_NOT_FOUND, unknown.getErrorCode());

        var foreign = assertThrows(MessageNotFoundException.class,
                () -> chatService.markRead("group", "alice", dm.getId()));
        assertEquals(ChatErrorCode.MESSAGE_CHANNEL_MISMATCH, foreign.getErrorCode());
    }

    @Test
    void readTrackingRequiresRosterParticipants() {
        var ex = assertThrows(ValidationException.class, () -> chatService.unreadCount("group", "mallory"));
        assertEquals("participant", ex.getField());
        assertThrows(ValidationException.class, () -> chatService.markRead("group", "system"));
        assertThrows(ValidationException.class, () -> chatService.getReadPositions("mallory"));
    }

    @Test
    void softDeletedMessagesAreHiddenFromDefaultReads() {
        chatService.sendMessage("group", "alice", "keep");
        ChatMessage oops = chatService.sendMessage("group", "alice", "oops");

        ChatMessage deleted = chatService.deleteMessage("group", oops.getId());
        assertTrue(deleted.isDeleted());

        assertEquals(List.of("keep"), contents(chatService.getMessages("group")));
        assertEquals(List.of("keep"), contents(chatService.getUnread("group", "bob")));
        assertEquals(1, chatService.unreadCount("group", "bob"));
        assertEquals(List.of("keep", "oops"),
                contents(chatService.getMessages("group", MessageQuery.builder().includeDeleted(true).build())));
    }

    @Test
    void editReplacesContentAndStampsEditTime() {
        ChatMessage original = chatService.sendMessage("group", "alice", "helo");

        ChatMessage edited = chatService.editMessage("group", original.getId(), "hello");

        assertEquals("hello", edited.getContent());
        assertNotNull(edited.getEditedAt());
        assertEquals(original.getCreatedAt(), edited.getCreatedAt());
        assertThrows(ValidationException.class, () -> chatService.editMessage("group", original.getId(), ""));
    }

    @Test
    void systemNoticesBypassMembership() {
        ChatMessage notice = chatService.broadcastSystem("dm_alice_bob", "maintenance at noon");

        assertEquals("system", notice.getSender());
        assertEquals(MessageType.SYSTEM, notice.getType());
        assertThrows(SenderNotInChannelException.class,
                () -> chatService.sendMessage("dm_alice_bob", "system", "impersonating"));
    }

    @Test
    void sendingTouchesChannelActivity() {
        chatService.sendMessage("dm_alice_carol", "carol", "first");
        chatService.sendMessage("group", "alice", "later");

        List<String> forAlice = chatService.listChannelsFor("alice").stream().map(Channel::getName).toList();
        assertEquals(List.of("group", "dm:alice-carol", "dm:alice-bob"), forAlice);
        assertNotNull(chatService.getChannel("group").getLastActivityAt());
    }

    @Test
    void readPositionsMapChannelNamesToCursors() {
        ChatMessage message = chatService.sendMessage("group", "alice", "hi");
        chatService.markRead("group", "bob", message.getId());
        chatService.unreadCount("dm_alice_bob", "bob");

        Map<String, Instant> positions = chatService.getReadPositions("bob");
        assertEquals(message.getCreatedAt(), positions.get("group"));
        assertTrue(positions.containsKey("dm:alice-bob"));
        assertNull(positions.get("dm:alice-bob"));
        assertFalse(positions.containsKey("dm:alice-carol"));
    }

    @Test
    void subscribersSeePersistedMessages() throws InterruptedException {
        try (MailboxSubscription subscription = chatService.subscribe("dm_bob_alice")) {
            ChatMessage sent = chatService.sendMessage("dm_alice_bob", "bob", "live");

            ChatMessageEvent event = subscription.poll(Duration.ofSeconds(1)).orElseThrow();
            assertEquals(ChatEventType.MESSAGE_CREATED, event.getType());
            assertEquals("dm:alice-bob", event.getChannelName());
            assertEquals(sent.getId(), event.getMessage().getId());
            assertTrue(messageRepository.existsById(event.getMessage().getId()));

            chatService.deleteMessage("dm:alice-bob", sent.getId());
            assertEquals(ChatEventType.MESSAGE_DELETED, subscription.poll(Duration.ofSeconds(1)).orElseThrow().getType());
        }
    }

    @Test
    void subscribeToUnknownChannelFails() {
        assertThrows(ChannelNotFoundException.class, () -> chatService.subscribe("nowhere"));
    }

    @Test
    void concurrentSendersGetDistinctSequences() throws Exception {
        int writers = 4;
        int perWriter = 10;
        List<String> senders = List.of("alice", "bob", "carol", "alice");
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        try {
            List<Callable<Void>> tasks = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                String sender = senders.get(w);
                int writer = w;
                tasks.add(() -> {
                    for (int i = 0; i < perWriter; i++) {
                        chatService.sendMessage("group", sender, "w" + writer + "-" + i);
                    }
                    return null;
                });
            }
            for (Future<Void> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }

        List<ChatMessage> messages = chatService.getMessages("group", MessageQuery.builder().limit(100).build());
        assertEquals(writers * perWriter, messages.size());
        assertEquals(writers * perWriter, messages.stream().map(ChatMessage::getSequence).distinct().count());
        for (int i = 1; i < messages.size(); i++) {
            assertTrue(messages.get(i - 1).getSequence() < messages.get(i).getSequence());
        }
        for (int w = 0; w < writers; w++) {
            String prefix = "w" + w + "-";
            List<String> own = contents(messages).stream().filter(c -> c.startsWith(prefix)).toList();
            for (int i = 0; i < perWriter; i++) {
                assertEquals(prefix + i, own.get(i));
            }
        }
    }
}
