package com.taskgraph.core.pathfinding;

import com.taskgraph.core.model.Vector3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Asynchronous path requests with poll-based completion.
 * <p>
 * Each request is computed on a background worker after an optional simulated
 * delay. Callers poll {@link #isComplete(long)}, read {@link #pathString(long)} and
 * then release the entry with {@link #cancel(long)}. Cancelling never blocks: the
 * entry is dropped at once and a worker that finishes later discards its result.
 * The computed path is a straight line rendered as {@code "(sx,sy,sz)->(tx,ty,tz)"}.
 */
public class PathfindingService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PathfindingService.class);

    public static final long INVALID_REQUEST_ID = 0L;

    private final ConcurrentHashMap<Long, PathRequest> requests = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1L);
    private final ScheduledExecutorService workers;

    public PathfindingService(int workerThreads) {
        this.workers = Executors.newScheduledThreadPool(Math.max(1, workerThreads), new WorkerThreadFactory());
    }

    /**
     * Submits a request and returns immediately.
     *
     * @param delaySeconds simulated computation time, 0 for as soon as a worker is free
     * @return the request id, never {@link #INVALID_REQUEST_ID}
     */
    public long request(Vector3 start, Vector3 target, float delaySeconds) {
        long id = nextId.getAndIncrement();
        var request = new PathRequest(start, target);
        requests.put(id, request);

        long delayMs = delaySeconds > 0f ? (long) (delaySeconds * 1000f) : 0L;
        request.future = workers.schedule(() -> complete(id), delayMs, TimeUnit.MILLISECONDS);

        log.debug("Submitted path request {} from {} to {} (delay {}ms)", id, start, target, delayMs);
        return id;
    }

    /**
     * @return true once the path is ready; false for pending, cancelled or unknown requests
     */
    public boolean isComplete(long id) {
        var request = requests.get(id);
        return request != null && request.result != null;
    }

    /**
     * @return the computed path, or the empty string if not complete or unknown
     */
    public String pathString(long id) {
        var request = requests.get(id);
        if (request == null || request.result == null) {
            return "";
        }
        return request.result;
    }

    /**
     * Drops a request. Safe on completed, already-cancelled and unknown ids.
     */
    public void cancel(long id) {
        var request = requests.remove(id);
        if (request == null) {
            return;
        }
        if (request.future != null) {
            request.future.cancel(false);
        }
        log.debug("Path request {} released", id);
    }

    public int pendingCount() {
        return requests.size();
    }

    private void complete(long id) {
        var request = requests.get(id);
        if (request == null) {
            log.debug("Path request {} was cancelled, discarding result", id);
            return;
        }
        request.result = request.start + "->" + request.target;
        log.debug("Path request {} completed: {}", id, request.result);
    }

    @Override
    public void close() {
        workers.shutdownNow();
        requests.clear();
    }

    private static final class PathRequest {
        private final Vector3 start;
        private final Vector3 target;
        private volatile String result;
        private volatile Future<?> future;

        private PathRequest(Vector3 start, Vector3 target) {
            this.start = start;
            this.target = target;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "pathfinding-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
