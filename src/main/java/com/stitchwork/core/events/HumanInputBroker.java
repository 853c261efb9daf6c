package com.stitchwork.core.events;

import com.stitchwork.core.EngineException;
import com.stitchwork.core.events.GraphEvents.HumanInputRequestEvent;
import com.stitchwork.core.events.GraphEvents.HumanInputResponseEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Request/response coordination between a running node and a human, carried over the
 * run's {@link EventBus}.
 */
public class HumanInputBroker {

    private static final Logger log = LoggerFactory.getLogger(HumanInputBroker.class);

    private final EventBus eventBus;

    public HumanInputBroker(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    /**
     * Emits a {@link HumanInputRequestEvent} and blocks until the matching response arrives.
     *
     * @return the human's answer
     * @throws TimeoutException if nobody answered in time
     * @throws EngineException  if the bus closed before an answer arrived
     */
    public String ask(String nodeId, String question, List<String> options, Duration timeout)
            throws TimeoutException, InterruptedException {
        String requestId = UUID.randomUUID().toString();
        // register before emitting so a fast responder cannot be missed
        CompletableFuture<HumanInputResponseEvent> response = eventBus.awaitEvent(
                HumanInputResponseEvent.class, e -> requestId.equals(e.requestId()));
        try {
            eventBus.emit(new HumanInputRequestEvent(eventBus.runId(), nodeId, requestId, question, options));
            log.info("Node {} waiting for human input ({})", nodeId, requestId);
            return response.get(timeout.toMillis(), TimeUnit.MILLISECONDS).response();
        } catch (ExecutionException e) {
            throw new EngineException("Human input request " + requestId + " failed", e.getCause());
        } catch (CancellationException e) {
            throw new EngineException("Human input request " + requestId + " abandoned: " + e.getMessage(), e);
        } finally {
            response.cancel(false);
        }
    }

    public void respond(String requestId, String answer) {
        eventBus.emit(new HumanInputResponseEvent(requestId, answer));
    }
}
