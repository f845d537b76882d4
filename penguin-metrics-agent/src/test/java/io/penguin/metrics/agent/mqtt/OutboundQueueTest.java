package io.penguin.metrics.agent.mqtt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class OutboundQueueTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static OutboundMessage message(String topic, Instant enqueuedAt) {
        return new OutboundMessage(topic, "{}", 1, true, enqueuedAt);
    }

    @Test
    @DisplayName("Should keep FIFO order and only remove delivered heads")
    void fifo() {
        OutboundQueue queue = new OutboundQueue(10, Duration.ofMinutes(10), CLOCK);
        OutboundMessage first = message("a", NOW);
        OutboundMessage second = message("b", NOW);
        queue.offer(first);
        queue.offer(second);

        assertSame(first, queue.peek());
        assertFalse(queue.remove(second), "Only the head can be removed");
        assertTrue(queue.remove(first));
        assertSame(second, queue.peek());
        assertEquals(1, queue.size());
    }

    @Test
    @DisplayName("Should drop the oldest message when full")
    void evictsOldestWhenFull() {
        OutboundQueue queue = new OutboundQueue(2, Duration.ofMinutes(10), CLOCK);
        queue.offer(message("a", NOW));
        queue.offer(message("b", NOW));
        queue.offer(message("c", NOW));

        assertEquals(2, queue.size());
        assertEquals("b", queue.peek().topic());
        assertEquals(1, queue.getDroppedCount());
    }

    @Test
    @DisplayName("Should keep the newest message when the bound is zero")
    void zeroBound() {
        OutboundQueue queue = new OutboundQueue(0, Duration.ofMinutes(10), CLOCK);
        queue.offer(message("a", NOW));
        queue.offer(message("b", NOW));

        assertEquals("b", queue.peek().topic());
        assertEquals(1, queue.getDroppedCount());
    }

    @Test
    @DisplayName("Should expire messages older than the age bound")
    void expiresOldMessages() {
        OutboundQueue queue = new OutboundQueue(10, Duration.ofMinutes(10), CLOCK);
        queue.offer(message("stale", NOW.minus(Duration.ofMinutes(11))));
        queue.offer(message("fresh", NOW.minus(Duration.ofMinutes(1))));

        assertEquals("fresh", queue.peek().topic());
        assertEquals(1, queue.getDroppedCount());
    }

    @Test
    @DisplayName("Should time out waiting on an empty queue")
    void awaitTimesOut() throws Exception {
        OutboundQueue queue = new OutboundQueue(10, Duration.ofMinutes(10), CLOCK);
        assertFalse(queue.awaitNonEmpty(Duration.ofMillis(20)));

        queue.offer(message("a", NOW));
        assertTrue(queue.awaitNonEmpty(Duration.ofMillis(20)));
    }
}
