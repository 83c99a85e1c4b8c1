package com.gamedrops.core.bus;

import com.gamedrops.core.events.AlertRaised;
import com.gamedrops.core.events.Event;
import com.gamedrops.core.events.TickStarted;
import com.gamedrops.core.model.TimeSample;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    private static final Instant NOW = Instant.parse("2026-01-02T09:00:00Z");

    @Test
    void publishNotifiesMultipleSubscribersForSameType() {
        EventBus bus = new EventBus();
        AtomicInteger hitsA = new AtomicInteger();
        AtomicInteger hitsB = new AtomicInteger();

        bus.subscribe(TickStarted.class, event -> hitsA.incrementAndGet());
        bus.subscribe(TickStarted.class, event -> hitsB.incrementAndGet());

        bus.publish(tickStarted());

        assertEquals(1, hitsA.get());
        assertEquals(1, hitsB.get());
    }

    @Test
    void publishRoutesToCorrectEventType() {
        EventBus bus = new EventBus();
        AtomicInteger tickHits = new AtomicInteger();
        AtomicInteger alertHits = new AtomicInteger();

        bus.subscribe(TickStarted.class, event -> tickHits.incrementAndGet());
        bus.subscribe(AlertRaised.class, event -> alertHits.incrementAndGet());

        bus.publish(tickStarted());
        bus.publish(new AlertRaised(NOW, "dispatch", "boom", Map.of()));
        bus.publish(new AlertRaised(NOW, "dispatch", "boom again", Map.of()));

        assertEquals(1, tickHits.get());
        assertEquals(2, alertHits.get());
    }

    @Test
    void catchAllSubscriberSeesEveryEventAfterTypedHandlers() {
        EventBus bus = new EventBus();
        List<String> order = new CopyOnWriteArrayList<>();

        bus.subscribe(Event.class, event -> order.add("all:" + event.type()));
        bus.subscribe(TickStarted.class, event -> order.add("typed:" + event.type()));

        bus.publish(tickStarted());
        bus.publish(new AlertRaised(NOW, "dispatch", "boom", Map.of()));

        assertEquals(List.of("typed:TickStarted", "all:TickStarted", "all:AlertRaised"), order);
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> capturedError.set(error));
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(TickStarted.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(TickStarted.class, event -> safeHits.incrementAndGet());

        bus.publish(tickStarted());

        assertEquals(1, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
    }

    @Test
    void publishWithoutSubscribersIsNoop() {
        new EventBus((event, error) -> {
            throw new AssertionError("no handler expected", error);
        }).publish(tickStarted());
    }

    private static TickStarted tickStarted() {
        return new TickStarted(NOW, TimeSample.of(DayOfWeek.FRIDAY, 9, 0), List.of("scrapers"));
    }
}
