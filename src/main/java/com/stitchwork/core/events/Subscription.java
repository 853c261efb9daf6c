package com.stitchwork.core.events;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Cursor over the events matching a type filter, in emission order.
 * <p>
 * Backed by a bounded queue filled by the emitting thread. When the queue is full the
 * subscription is disconnected: events already buffered can still be read, after which
 * reads throw {@link SubscriberOverrunException}.
 */
public final class Subscription implements AutoCloseable {

    private final Set<Class<? extends EngineEvent>> types;
    private final ArrayBlockingQueue<Event> queue;
    private final Consumer<Subscription> onClose;

    private volatile boolean closed;
    private volatile boolean overrun;

    Subscription(Set<Class<? extends EngineEvent>> types, int capacity, Consumer<Subscription> onClose) {
        this.types = Set.copyOf(types);
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.onClose = onClose;
    }

    boolean matches(EngineEvent event) {
        if (types.isEmpty()) {
            return true;
        }
        for (Class<? extends EngineEvent> type : types) {
            if (type.isInstance(event)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Called by the emitter. Returns false when the queue is full.
     */
    boolean offer(Event event) {
        return !closed && queue.offer(event);
    }

    void markOverrun() {
        overrun = true;
        closed = true;
    }

    /**
     * Next buffered event, or null if none is available right now.
     */
    public Event poll() {
        Event event = queue.poll();
        if (event == null) {
            checkOverrun();
        }
        return event;
    }

    /**
     * Waits up to {@code timeout} for the next event. Returns null on timeout or when the
     * subscription was closed and fully drained.
     */
    public Event next(Duration timeout) throws InterruptedException {
        Event event = queue.poll();
        if (event != null) {
            return event;
        }
        checkOverrun();
        if (closed) {
            return null;
        }
        event = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (event == null) {
            checkOverrun();
        }
        return event;
    }

    /**
     * Removes and returns every buffered event.
     */
    public List<Event> drain() {
        var events = new ArrayList<Event>();
        queue.drainTo(events);
        if (events.isEmpty()) {
            checkOverrun();
        }
        return events;
    }

    public boolean isActive() {
        return !closed;
    }

    public boolean isOverrun() {
        return overrun;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            onClose.accept(this);
        }
    }

    private void checkOverrun() {
        if (overrun) {
            throw new SubscriberOverrunException("Subscriber for " + describeTypes()
                    + " fell behind (queue capacity " + (queue.remainingCapacity() + queue.size())
                    + ") and was disconnected");
        }
    }

    private String describeTypes() {
        if (types.isEmpty()) {
            return "all events";
        }
        return types.stream().map(Class::getSimpleName).sorted().toList().toString();
    }
}
