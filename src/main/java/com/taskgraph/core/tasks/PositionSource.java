package com.taskgraph.core.tasks;

import com.taskgraph.core.model.Vector3;

/**
 * Entity position and movement owned by the world, outside the blackboard.
 * <p>
 * Movement tasks read the position and request a velocity; integrating that
 * velocity belongs to whatever system owns the entity.
 */
public interface PositionSource {

    Vector3 position();

    void applyVelocity(Vector3 velocity);
}
