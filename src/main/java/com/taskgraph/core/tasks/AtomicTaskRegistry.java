package com.taskgraph.core.tasks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Maps task ids to factories that build a fresh {@link AtomicTask} per node entry.
 * <p>
 * An explicit instance, populated at startup (see {@link BuiltinTasks}) and passed to
 * the executor. Registration is thread-safe so plugins may register from any thread
 * before ticking starts.
 */
public class AtomicTaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(AtomicTaskRegistry.class);

    private final ConcurrentHashMap<String, Supplier<? extends AtomicTask>> factories = new ConcurrentHashMap<>();

    /**
     * Registers a factory; a later registration under the same id replaces the earlier one.
     */
    public void register(String id, Supplier<? extends AtomicTask> factory) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id must not be blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("Factory for task '" + id + "' must not be null");
        }
        var previous = factories.put(id, factory);
        if (previous != null) {
            log.info("Replaced factory for atomic task '{}'", id);
        } else {
            log.debug("Registered atomic task '{}'", id);
        }
    }

    /**
     * @return a new task instance, or empty if {@code id} is unknown
     */
    public Optional<AtomicTask> create(String id) {
        if (id == null) {
            return Optional.empty();
        }
        var factory = factories.get(id);
        if (factory == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(factory.get());
    }

    public boolean isRegistered(String id) {
        return id != null && factories.containsKey(id);
    }

    /**
     * All registered ids, sorted.
     */
    public List<String> getAllTaskIds() {
        return factories.keySet().stream().sorted().toList();
    }

    public int size() {
        return factories.size();
    }
}
