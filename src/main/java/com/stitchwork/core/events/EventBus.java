package com.stitchwork.core.events;

import com.stitchwork.core.EngineException;
import com.stitchwork.core.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Typed, ordered publish/subscribe channel for one run.
 * <p>
 * Every emitted event gets the next sequence number, is appended to the log and is then
 * offered to each matching subscription and pending waiter. Emission is serialised so all
 * subscribers and waiters observe the same order; waiter predicates therefore run under the
 * emission lock and must not block. Emitters never wait for subscribers: a subscription
 * whose bounded queue is full is disconnected instead.
 * <p>
 * One bus is created per run and closed when the run ends; nothing here is global.
 */
public class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final String runId;
    private final int subscriberCapacity;
    private final EngineMetrics metrics;
    private final Clock clock;

    /** Append-only log keyed by sequence; readers iterate without locking. */
    private final ConcurrentSkipListMap<Long, Event> eventLog = new ConcurrentSkipListMap<>();

    private final CopyOnWriteArrayList<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Waiter<?>> waiters = new CopyOnWriteArrayList<>();
    private final Object emitLock = new Object();

    private long sequence;
    private volatile boolean closed;
    private ExecutorService listenerPool;

    public EventBus(String runId) {
        this(runId, 1024, null, Clock.systemUTC());
    }

    public EventBus(String runId, int subscriberCapacity, EngineMetrics metrics, Clock clock) {
        if (subscriberCapacity < 1) {
            throw new IllegalArgumentException("subscriberCapacity must be >= 1");
        }
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        this.subscriberCapacity = subscriberCapacity;
        this.metrics = metrics;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public String runId() {
        return runId;
    }

    /**
     * Makes the next emitted event follow {@code lastSequence}, so a resumed run continues the
     * numbering of the checkpointed one. Only allowed before the first emit.
     */
    public void continueFrom(long lastSequence) {
        synchronized (emitLock) {
            if (sequence != 0) {
                throw new IllegalStateException("Event bus for run " + runId + " already emitted events");
            }
            if (lastSequence < 0) {
                throw new IllegalArgumentException("lastSequence must be >= 0");
            }
            sequence = lastSequence;
        }
    }

    /**
     * Appends the event to the log and dispatches it to matching subscriptions and waiters.
     *
     * @return the stored envelope
     * @throws IllegalStateException if the bus has been closed
     */
    public Event emit(EngineEvent payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        Event event;
        synchronized (emitLock) {
            if (closed) {
                throw new IllegalStateException("Event bus for run " + runId + " is closed");
            }
            event = new Event(++sequence, payload.getClass().getSimpleName(), payload.nodeId(),
                    payload, clock.instant());
            eventLog.put(event.sequence(), event);
            for (Subscription sub : subscriptions) {
                if (sub.matches(payload) && !sub.offer(event)) {
                    disconnect(sub, event);
                }
            }
            // waiters see events in sequence order, like subscriptions
            for (Waiter<?> waiter : waiters) {
                waiter.offer(payload);
            }
        }
        log.debug("Emitted #{} {} node={}", event.sequence(), event.type(), event.nodeId());
        return event;
    }

    /**
     * Opens a cursor over future events whose payload is an instance of one of {@code types}.
     * An empty set subscribes to everything.
     */
    public Subscription subscribe(Set<Class<? extends EngineEvent>> types) {
        ensureOpen();
        var sub = new Subscription(types, subscriberCapacity, subscriptions::remove);
        subscriptions.add(sub);
        log.debug("Subscribed to {}", types.isEmpty() ? "all events" : types);
        return sub;
    }

    public Subscription subscribeAll() {
        return subscribe(Set.of());
    }

    /**
     * Callback-style subscription: events are pumped to {@code consumer} on a daemon thread,
     * in emission order. A consumer that throws is logged and keeps receiving events.
     */
    public Subscription listen(Set<Class<? extends EngineEvent>> types, Consumer<Event> consumer) {
        Subscription sub = subscribe(types);
        listenerPool().execute(() -> pump(sub, consumer));
        return sub;
    }

    /**
     * Blocks until an event of {@code type} satisfying {@code predicate} is emitted.
     *
     * @throws TimeoutException     if nothing matched within {@code timeout}
     * @throws InterruptedException if the caller is interrupted; the wait is unregistered
     */
    public <T extends EngineEvent> T waitFor(Class<T> type, Predicate<? super T> predicate, Duration timeout)
            throws TimeoutException, InterruptedException {
        CompletableFuture<T> future = awaitEvent(type, predicate);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new EngineException("Waiting for " + type.getSimpleName() + " failed", cause);
        } finally {
            future.cancel(false);
        }
    }

    /**
     * Asynchronous form of {@link #waitFor}. Cancelling the returned future unregisters the wait
     * without affecting other subscribers.
     */
    public <T extends EngineEvent> CompletableFuture<T> awaitEvent(Class<T> type, Predicate<? super T> predicate) {
        var future = new CompletableFuture<T>();
        var waiter = new Waiter<>(type, predicate, future);
        synchronized (emitLock) {
            if (closed) {
                future.completeExceptionally(new IllegalStateException("Event bus for run " + runId + " is closed"));
                return future;
            }
            waiters.add(waiter);
        }
        future.whenComplete((result, error) -> waiters.remove(waiter));
        return future;
    }

    /**
     * Snapshot of the whole retained log in sequence order.
     */
    public List<Event> log() {
        return new ArrayList<>(eventLog.values());
    }

    /**
     * Retained events with a sequence greater than {@code afterSequence}.
     */
    public List<Event> eventsSince(long afterSequence) {
        return new ArrayList<>(eventLog.tailMap(afterSequence, false).values());
    }

    public long lastSequence() {
        synchronized (emitLock) {
            return sequence;
        }
    }

    /**
     * Drops retained events up to and including {@code upToSequence}. Sequence numbering continues.
     */
    public int prune(long upToSequence) {
        var head = eventLog.headMap(upToSequence, true);
        int removed = head.size();
        head.clear();
        return removed;
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    @Override
    public void close() {
        synchronized (emitLock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        for (Subscription sub : subscriptions) {
            sub.close();
        }
        for (Waiter<?> waiter : waiters) {
            waiter.future.completeExceptionally(new CancellationException("Event bus for run " + runId + " closed"));
        }
        synchronized (this) {
            if (listenerPool != null) {
                listenerPool.shutdown();
            }
        }
        log.debug("Closed event bus for run {} after {} events", runId, sequence);
    }

    private void disconnect(Subscription sub, Event event) {
        sub.markOverrun();
        subscriptions.remove(sub);
        log.warn("Subscriber overrun at event #{} ({}); disconnecting subscriber", event.sequence(), event.type());
        if (metrics != null) {
            metrics.recordSubscriberOverrun();
        }
    }

    private void pump(Subscription sub, Consumer<Event> consumer) {
        try {
            while (true) {
                Event event = sub.next(Duration.ofMillis(200));
                if (event != null) {
                    deliverSafely(consumer, event);
                } else if (!sub.isActive()) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (SubscriberOverrunException e) {
            log.warn("Listener stopped: {}", e.getMessage());
        }
    }

    private void deliverSafely(Consumer<Event> consumer, Event event) {
        try {
            consumer.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}", event.type(), e.getMessage(), e);
        }
    }

    private synchronized ExecutorService listenerPool() {
        if (listenerPool == null) {
            listenerPool = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "event-listener-" + runId);
                t.setDaemon(true);
                return t;
            });
        }
        return listenerPool;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Event bus for run " + runId + " is closed");
        }
    }

    private static final class Waiter<T extends EngineEvent> {
        private final Class<T> type;
        private final Predicate<? super T> predicate;
        private final CompletableFuture<T> future;

        Waiter(Class<T> type, Predicate<? super T> predicate, CompletableFuture<T> future) {
            this.type = type;
            this.predicate = predicate;
            this.future = future;
        }

        void offer(EngineEvent event) {
            if (future.isDone() || !type.isInstance(event)) {
                return;
            }
            T candidate = type.cast(event);
            try {
                if (predicate.test(candidate)) {
                    future.complete(candidate);
                }
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        }
    }
}
