package com.fiveminds.core.events;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for run lifecycle events.
 * <p>
 * Supports per-run subscriptions and global subscriptions that receive all events.
 * Publishing is fire-and-forget: events are handed to a single dispatcher thread, so
 * publishers never wait on subscribers and every subscriber sees events in publish order.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-run subscribers keyed by runId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<FiveMindsEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all runs. */
    private final CopyOnWriteArrayList<Consumer<FiveMindsEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    private final Executor dispatcher;
    private final ExecutorService ownedDispatcher;

    @Autowired
    public EventBus() {
        this.ownedDispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "fiveminds-events");
            t.setDaemon(true);
            return t;
        });
        this.dispatcher = ownedDispatcher;
    }

    /**
     * Creates a bus that delivers on the given executor. {@code Runnable::run} gives
     * synchronous delivery, which tests use.
     */
    public EventBus(Executor dispatcher) {
        this.dispatcher = dispatcher;
        this.ownedDispatcher = null;
    }

    /**
     * Publish an event to all matching subscribers (run-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(FiveMindsEvent event) {
        log.debug("Publishing event: {} for run {} ({})", event.eventType(), event.runId(), event.entityId());
        try {
            dispatcher.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.warn("Event bus is shut down, dropping {} for run {}", event.eventType(), event.runId());
        }
    }

    private void deliver(FiveMindsEvent event) {
        List<Consumer<FiveMindsEvent>> runSubs = event.runId() != null ? runSubscribers.get(event.runId()) : null;
        if (runSubs != null) {
            for (Consumer<FiveMindsEvent> subscriber : runSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<FiveMindsEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific run.
     *
     * @param runId    the run to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<FiveMindsEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to run {}", runId);
        return () -> {
            CopyOnWriteArrayList<Consumer<FiveMindsEvent>> subs = runSubscribers.get(runId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events from all runs.
     *
     * @param consumer callback invoked for each event regardless of run
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<FiveMindsEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    @PreDestroy
    public void shutdown() {
        if (ownedDispatcher != null) {
            ownedDispatcher.shutdown();
        }
    }

    private void deliverSafely(Consumer<FiveMindsEvent> subscriber, FiveMindsEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
