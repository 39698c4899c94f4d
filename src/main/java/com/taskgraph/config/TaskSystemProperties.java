package com.taskgraph.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "taskgraph")
public class TaskSystemProperties {

    private Tick tick = new Tick();
    private Pathfinding pathfinding = new Pathfinding();
    private Movement movement = new Movement();

    /** When false the executor publishes no snapshots. */
    private boolean publishSnapshots = true;

    public Tick getTick() { return tick; }
    public void setTick(Tick tick) { this.tick = tick; }
    public Pathfinding getPathfinding() { return pathfinding; }
    public void setPathfinding(Pathfinding pathfinding) { this.pathfinding = pathfinding; }
    public Movement getMovement() { return movement; }
    public void setMovement(Movement movement) { this.movement = movement; }
    public boolean isPublishSnapshots() { return publishSnapshots; }
    public void setPublishSnapshots(boolean publishSnapshots) { this.publishSnapshots = publishSnapshots; }

    public static class Tick {
        private float deltaSeconds = 0.016f;
        private int maxTicks = 600;

        public float getDeltaSeconds() { return deltaSeconds; }
        public void setDeltaSeconds(float deltaSeconds) { this.deltaSeconds = deltaSeconds; }
        public int getMaxTicks() { return maxTicks; }
        public void setMaxTicks(int maxTicks) { this.maxTicks = maxTicks; }
    }

    public static class Pathfinding {
        private int workerThreads = 2;

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    public static class Movement {
        private float defaultSpeed = 100f;
        private float acceptanceRadius = 0.5f;

        public float getDefaultSpeed() { return defaultSpeed; }
        public void setDefaultSpeed(float defaultSpeed) { this.defaultSpeed = defaultSpeed; }
        public float getAcceptanceRadius() { return acceptanceRadius; }
        public void setAcceptanceRadius(float acceptanceRadius) { this.acceptanceRadius = acceptanceRadius; }
    }
}
