package com.example.triangle.broadcast;

import com.example.triangle.event.ChatMessageEvent;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Subscription with a bounded buffer. When the buffer is full the oldest event is discarded to make room.
 */
public class MailboxSubscription extends ChannelSubscription {

    private final int capacity;
    private final Deque<ChatMessageEvent> buffer = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final AtomicLong dropped = new AtomicLong();

    MailboxSubscription(String channelName, ChannelBroadcaster owner, int capacity) {
        super(channelName, owner);
        if (capacity < 1) {
            throw new IllegalArgumentException("Mailbox capacity must be positive");
        }
        this.capacity = capacity;
    }

    @Override
    void deliver(ChatMessageEvent event) {
        lock.lock();
        try {
            if (buffer.size() >= capacity) {
                buffer.pollFirst();
                dropped.incrementAndGet();
            }
            buffer.addLast(event);
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next event.
     */
    public Optional<ChatMessageEvent> poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (buffer.isEmpty()) {
                if (remaining <= 0 || !isActive()) {
                    return Optional.empty();
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return Optional.of(buffer.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns every buffered event without waiting.
     */
    public List<ChatMessageEvent> drain() {
        lock.lock();
        try {
            List<ChatMessageEvent> events = new ArrayList<>(buffer);
            buffer.clear();
            return events;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    @Override
    void deactivate() {
        super.deactivate();
        lock.lock();
        try {
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
