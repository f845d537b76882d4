package io.penguin.metrics.agent.mqtt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO of messages waiting for the broker.
 * When the size bound is hit the oldest message is dropped; messages older than the age bound
 * are dropped when they reach the head. A message leaves the queue only through
 * {@link #remove(OutboundMessage)} after it was delivered.
 */
public class OutboundQueue {

    private static final Logger log = LoggerFactory.getLogger(OutboundQueue.class);

    private final Deque<OutboundMessage> messages = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final int maxSize;
    private final Duration maxAge;
    private final Clock clock;
    private final AtomicLong droppedCount = new AtomicLong(0);

    public OutboundQueue(int maxSize, Duration maxAge) {
        this(maxSize, maxAge, Clock.systemUTC());
    }

    public OutboundQueue(int maxSize, Duration maxAge, Clock clock) {
        this.maxSize = maxSize;
        this.maxAge = maxAge;
        this.clock = clock;
    }

    public void offer(OutboundMessage message) {
        lock.lock();
        try {
            while (!messages.isEmpty() && messages.size() >= maxSize) {
                OutboundMessage dropped = messages.pollFirst();
                droppedCount.incrementAndGet();
                log.warn("Outbound queue full, dropped message for {}", dropped.topic());
            }
            messages.addLast(message);
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the oldest live message without removing it, or {@code null}
     */
    public OutboundMessage peek() {
        lock.lock();
        try {
            expire();
            return messages.peekFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes {@code message} if it is still the head. It may already be gone after an eviction.
     */
    public boolean remove(OutboundMessage message) {
        lock.lock();
        try {
            if (messages.peekFirst() == message) {
                messages.pollFirst();
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until a message is available or the timeout elapses.
     */
    public boolean awaitNonEmpty(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            long nanos = timeout.toNanos();
            while (messages.isEmpty()) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return messages.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    private void expire() {
        long now = clock.millis();
        while (!messages.isEmpty()
                && now - messages.peekFirst().enqueuedAt().toEpochMilli() > maxAge.toMillis()) {
            OutboundMessage dropped = messages.pollFirst();
            droppedCount.incrementAndGet();
            log.warn("Dropped expired message for {}", dropped.topic());
        }
    }
}
