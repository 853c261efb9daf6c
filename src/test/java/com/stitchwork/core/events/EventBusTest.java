package com.stitchwork.core.events;

import com.stitchwork.core.EngineException;
import com.stitchwork.core.events.GraphEvents.CheckpointSavedEvent;
import com.stitchwork.core.events.GraphEvents.HumanInputRequestEvent;
import com.stitchwork.core.events.GraphEvents.NodeErrorEvent;
import com.stitchwork.core.events.GraphEvents.NodeStartEvent;
import com.stitchwork.core.metrics.EngineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus("run-1");
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private static NodeStartEvent start(String nodeId) {
        return new NodeStartEvent("run-1", nodeId, nodeId, 1);
    }

    // -- Ordering and filtering ------------------------------------------------

    @Nested
    @DisplayName("emit and subscribe")
    class EmitAndSubscribe {

        @Test
        @DisplayName("sequence numbers increase by one and the log keeps emission order")
        void monotonicSequence() {
            Event first = bus.emit(start("a"));
            Event second = bus.emit(new CheckpointSavedEvent("run-1", "cp", 1));
            Event third = bus.emit(start("b"));

            assertEquals(1, first.sequence());
            assertEquals(2, second.sequence());
            assertEquals(3, third.sequence());
            assertEquals(List.of(first, second, third), bus.log());
            assertEquals(List.of(third), bus.eventsSince(2));
            assertEquals("NodeStartEvent", first.type());
            assertEquals("a", first.nodeId());
        }

        @Test
        @DisplayName("subscribers only see events of the requested types, emitted after subscribing")
        void typeFilter() {
            bus.emit(start("early"));
            Subscription starts = bus.subscribe(Set.of(NodeStartEvent.class));
            Subscription all = bus.subscribeAll();

            bus.emit(start("a"));
            bus.emit(new NodeErrorEvent("run-1", "a", "boom", 1, false));
            bus.emit(start("b"));

            List<String> startNodes = starts.drain().stream().map(Event::nodeId).toList();
            assertEquals(List.of("a", "b"), startNodes);
            assertEquals(3, all.drain().size());
            assertNull(starts.poll());
        }

        @Test
        @DisplayName("two subscribers observe the same order")
        void sameOrderForAll() {
            Subscription one = bus.subscribeAll();
            Subscription two = bus.subscribeAll();
            for (int i = 0; i < 20; i++) {
                bus.emit(start("n" + i));
            }
            assertEquals(one.drain(), two.drain());
        }

        @Test
        @DisplayName("closed subscriptions stop receiving and are unregistered")
        void closeUnsubscribes() {
            Subscription sub = bus.subscribeAll();
            assertEquals(1, bus.subscriberCount());
            sub.close();
            bus.emit(start("a"));
            assertEquals(0, bus.subscriberCount());
            assertTrue(sub.drain().isEmpty());
        }

        @Test
        @DisplayName("emitting on a closed bus fails")
        void emitAfterClose() {
            bus.close();
            assertThrows(IllegalStateException.class, () -> bus.emit(start("a")));
        }
    }

    // -- Backpressure ----------------------------------------------------------

    @Nested
    @DisplayName("overrun")
    class Overrun {

        @Test
        @DisplayName("a full subscriber is disconnected without blocking the emitter")
        void slowSubscriberDisconnected() {
            var registry = new SimpleMeterRegistry();
            try (var small = new EventBus("run-2", 2, new EngineMetrics(registry), Clock.systemUTC())) {
                Subscription slow = small.subscribeAll();
                Subscription fast = small.subscribeAll();

                small.emit(start("a"));
                small.emit(start("b"));
                assertEquals(2, fast.drain().size());
                small.emit(start("c"));

                assertTrue(slow.isOverrun());
                assertFalse(slow.isActive());
                assertEquals(List.of("a", "b"), slow.drain().stream().map(Event::nodeId).toList());
                assertThrows(SubscriberOverrunException.class, slow::poll);

                assertEquals("c", fast.poll().nodeId());
                assertEquals(1, small.subscriberCount());
                assertEquals(1.0, registry.find("stitchwork.events.subscriber_overruns").counter().count());
            }
        }
    }

    // -- Waiting ---------------------------------------------------------------

    @Nested
    @DisplayName("waitFor and awaitEvent")
    class Waiting {

        @Test
        @DisplayName("waitFor returns the first matching event")
        void waitForMatch() throws Exception {
            Thread emitter = new Thread(() -> {
                bus.emit(start("a"));
                bus.emit(start("target"));
            });
            emitter.start();
            NodeStartEvent event = bus.waitFor(NodeStartEvent.class, e -> e.nodeId().equals("target"),
                    Duration.ofSeconds(5));
            emitter.join();
            assertEquals("target", event.nodeId());
        }

        @Test
        @DisplayName("waitFor times out when nothing matches")
        void waitForTimeout() {
            assertThrows(TimeoutException.class,
                    () -> bus.waitFor(NodeStartEvent.class, e -> true, Duration.ofMillis(50)));
        }

        @Test
        @DisplayName("cancelling one wait leaves other subscribers untouched")
        void cancelWait() throws Exception {
            var cancelled = bus.awaitEvent(NodeStartEvent.class, e -> true);
            var other = bus.awaitEvent(NodeStartEvent.class, e -> true);
            Subscription sub = bus.subscribeAll();

            assertTrue(cancelled.cancel(false));
            bus.emit(start("a"));

            assertEquals("a", other.get(1, TimeUnit.SECONDS).nodeId());
            assertEquals(1, sub.drain().size());
        }

        @Test
        @DisplayName("closing the bus cancels pending waits")
        void closeCancelsWaits() {
            var pending = bus.awaitEvent(NodeStartEvent.class, e -> true);
            bus.close();
            assertThrows(CancellationException.class, () -> pending.get(1, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("waiters see concurrent emissions in the same order as subscribers")
        void waitersShareSubscriberOrder() throws Exception {
            var ordered = new EventBus("run-order", 4096, null, Clock.systemUTC());
            Subscription sub = ordered.subscribe(Set.of(NodeStartEvent.class));
            var seenByWaiter = new CopyOnWriteArrayList<String>();
            var pending = ordered.awaitEvent(NodeStartEvent.class, e -> {
                seenByWaiter.add(e.nodeId());
                return false;
            });

            var emitters = new ArrayList<Thread>();
            for (int t = 0; t < 4; t++) {
                int thread = t;
                emitters.add(new Thread(() -> {
                    for (int i = 0; i < 250; i++) {
                        ordered.emit(new NodeStartEvent("run-order", thread + "-" + i, "n", 1));
                    }
                }));
            }
            emitters.forEach(Thread::start);
            for (Thread emitter : emitters) {
                emitter.join();
            }

            List<String> seenBySubscriber = sub.drain().stream().map(Event::nodeId).toList();
            assertEquals(1000, seenBySubscriber.size());
            assertEquals(seenBySubscriber, seenByWaiter);
            pending.cancel(false);
            ordered.close();
        }
    }

    // -- Listeners and log maintenance ----------------------------------------

    @Test
    @DisplayName("a throwing listener keeps receiving later events")
    void listenerIsolatesFailures() throws Exception {
        var seen = new CopyOnWriteArrayList<String>();
        var latch = new CountDownLatch(3);
        bus.listen(Set.of(NodeStartEvent.class), event -> {
            seen.add(event.nodeId());
            latch.countDown();
            if (event.nodeId().equals("a")) {
                throw new IllegalStateException("listener bug");
            }
        });

        bus.emit(start("a"));
        bus.emit(start("b"));
        bus.emit(start("c"));

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("a", "b", "c"), seen);
    }

    @Test
    @DisplayName("pruning drops old events but numbering continues")
    void prune() {
        bus.emit(start("a"));
        bus.emit(start("b"));
        bus.emit(start("c"));

        assertEquals(2, bus.prune(2));
        assertEquals(List.of(3L), bus.log().stream().map(Event::sequence).toList());
        assertEquals(4, bus.emit(start("d")).sequence());
    }

    @Test
    @DisplayName("continueFrom resumes numbering and is only allowed before the first emit")
    void continueFrom() {
        bus.continueFrom(41);
        assertEquals(42, bus.emit(start("a")).sequence());
        assertThrows(IllegalStateException.class, () -> bus.continueFrom(100));
        assertThrows(IllegalArgumentException.class, () -> new EventBus("x").continueFrom(-1));
    }

    @Test
    @DisplayName("human input broker round-trips a question through the bus")
    void humanInput() throws Exception {
        var broker = new HumanInputBroker(bus);
        bus.listen(Set.of(HumanInputRequestEvent.class), event -> {
            var request = event.payloadAs(HumanInputRequestEvent.class);
            broker.respond(request.requestId(), request.options().get(1));
        });

        String answer = broker.ask("n1", "Keep the old signature?", List.of("yes", "no"), Duration.ofSeconds(5));

        assertEquals("no", answer);
    }

    @Test
    @DisplayName("closing the bus while a node waits for human input raises an engine error")
    void humanInputAbandoned() {
        var broker = new HumanInputBroker(bus);
        bus.listen(Set.of(HumanInputRequestEvent.class), event -> bus.close());

        var ex = assertThrows(EngineException.class,
                () -> broker.ask("n1", "still there?", List.of(), Duration.ofSeconds(5)));
        assertTrue(ex.getMessage().contains("abandoned"));
    }

    @Test
    @DisplayName("unanswered human input times out")
    void humanInputTimeout() {
        var broker = new HumanInputBroker(bus);
        assertThrows(TimeoutException.class,
                () -> broker.ask("n1", "anyone?", List.of(), Duration.ofMillis(50)));
    }
}
