package com.taskgraph.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for executor snapshots.
 * <p>
 * Supports per-entity subscriptions and global subscriptions that receive every snapshot.
 * Thread-safe for concurrent publish and subscribe operations. A subscriber that throws
 * is logged and never affects the executor or other subscribers.
 */
public class ExecutionEventBus implements ExecutionObserver {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEventBus.class);

    /** Per-entity subscribers keyed by entity id. */
    private final ConcurrentHashMap<Long, CopyOnWriteArrayList<Consumer<ExecutionSnapshot>>> entitySubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<ExecutionSnapshot>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    @Override
    public void onTick(ExecutionSnapshot snapshot) {
        publish(snapshot);
    }

    /**
     * Publish a snapshot to the entity's subscribers, then to global subscribers.
     */
    public void publish(ExecutionSnapshot snapshot) {
        List<Consumer<ExecutionSnapshot>> entitySubs = entitySubscribers.get(snapshot.entityId());
        if (entitySubs != null) {
            for (Consumer<ExecutionSnapshot> subscriber : entitySubs) {
                deliverSafely(subscriber, snapshot);
            }
        }
        for (Consumer<ExecutionSnapshot> subscriber : globalSubscribers) {
            deliverSafely(subscriber, snapshot);
        }
    }

    /**
     * Subscribe to snapshots of a single entity.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(long entityId, Consumer<ExecutionSnapshot> consumer) {
        entitySubscribers.computeIfAbsent(entityId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to entity {}", entityId);
        return () -> entitySubscribers.computeIfPresent(entityId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<ExecutionSnapshot> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all entities (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /** Number of entities with at least one subscriber. */
    int watchedEntityCount() {
        return entitySubscribers.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ExecutionSnapshot> subscriber, ExecutionSnapshot snapshot) {
        try {
            subscriber.accept(snapshot);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing snapshot for entity {}: {}",
                    snapshot.entityId(), e.getMessage(), e);
        }
    }
}
