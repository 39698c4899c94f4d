package com.taskgraph.core.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns loaded templates and hands out numeric asset ids for them.
 * <p>
 * Templates are cached by normalized absolute path, so loading the same file twice
 * returns the same id. Runners keep only the id and the shared read-only template.
 */
public class TaskGraphAssetManager {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphAssetManager.class);

    public static final long INVALID_ASSET_ID = 0L;

    private final TaskGraphLoader loader;
    private final ConcurrentHashMap<String, Long> idsByKey = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, TaskGraphTemplate> templates = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1L);

    public TaskGraphAssetManager(TaskGraphLoader loader) {
        this.loader = loader;
    }

    /**
     * Loads a graph file, or returns the id of the already-loaded copy.
     *
     * @return the asset id, or {@link #INVALID_ASSET_ID} if the file could not be loaded
     */
    public long load(Path path) {
        String key = path.toAbsolutePath().normalize().toString();
        Long existing = idsByKey.get(key);
        if (existing != null) {
            log.debug("Task graph {} already loaded as asset {}", key, existing);
            return existing;
        }

        TaskGraphTemplate template;
        try {
            template = loader.load(path);
        } catch (TaskGraphLoadException | TemplateValidationException e) {
            log.error("Failed to load task graph {}: {}", key, e.getMessage());
            return INVALID_ASSET_ID;
        }
        return store(key, template);
    }

    public long load(String path) {
        return load(Path.of(path));
    }

    /**
     * Registers a template built in memory under the given key.
     *
     * @return the asset id; an existing id when the key is already registered
     */
    public long register(String key, TaskGraphTemplate template) {
        Long existing = idsByKey.get(key);
        if (existing != null) {
            return existing;
        }
        return store(key, template.requireValid());
    }

    private synchronized long store(String key, TaskGraphTemplate template) {
        Long existing = idsByKey.get(key);
        if (existing != null) {
            return existing;
        }
        long id = nextId.getAndIncrement();
        templates.put(id, template);
        idsByKey.put(key, id);
        log.info("Registered task graph '{}' as asset {} ({})", template.name(), id, key);
        return id;
    }

    public Optional<TaskGraphTemplate> get(long assetId) {
        return Optional.ofNullable(templates.get(assetId));
    }

    /**
     * Drops a template. Runners still holding it keep their reference; new lookups fail.
     */
    public synchronized boolean unload(long assetId) {
        TaskGraphTemplate removed = templates.remove(assetId);
        if (removed == null) {
            return false;
        }
        idsByKey.values().removeIf(id -> id == assetId);
        log.info("Unloaded task graph '{}' (asset {})", removed.name(), assetId);
        return true;
    }

    public int loadedCount() {
        return templates.size();
    }
}
