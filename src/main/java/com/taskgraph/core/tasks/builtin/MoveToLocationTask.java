package com.taskgraph.core.tasks.builtin;

import com.taskgraph.core.blackboard.BlackboardException;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.model.TaskValue;
import com.taskgraph.core.model.VariableType;
import com.taskgraph.core.model.Vector3;
import com.taskgraph.core.tasks.AtomicTask;
import com.taskgraph.core.tasks.PositionSource;
import com.taskgraph.core.tasks.TaskContext;
import com.taskgraph.core.tasks.TaskParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Moves the entity toward {@code Target} at {@code Speed} units per second.
 * <p>
 * World mode, when the context carries a {@link PositionSource}: the task reads the
 * position and requests a velocity of {@code direction * speed}; on arrival it zeroes
 * the velocity and succeeds. Integration is left to the owner of the position.
 * <p>
 * Headless mode: the task integrates the blackboard's {@code Position} vector by
 * {@code speed * dt} per tick and snaps exactly onto the target once the remaining
 * distance is within the acceptance radius or one step.
 */
public class MoveToLocationTask implements AtomicTask {

    private static final Logger log = LoggerFactory.getLogger(MoveToLocationTask.class);

    public static final String ID = "MoveToLocation";
    public static final String PARAM_TARGET = "Target";
    public static final String PARAM_SPEED = "Speed";
    public static final String PARAM_ACCEPTANCE_RADIUS = "AcceptanceRadius";
    public static final String BB_POSITION = "Position";

    public static final float DEFAULT_SPEED = 100f;
    public static final float DEFAULT_ACCEPTANCE_RADIUS = 0.5f;

    private final float defaultSpeed;
    private final float defaultAcceptanceRadius;

    public MoveToLocationTask() {
        this(DEFAULT_SPEED, DEFAULT_ACCEPTANCE_RADIUS);
    }

    public MoveToLocationTask(float defaultSpeed, float defaultAcceptanceRadius) {
        this.defaultSpeed = defaultSpeed > 0f ? defaultSpeed : DEFAULT_SPEED;
        this.defaultAcceptanceRadius = defaultAcceptanceRadius >= 0f ? defaultAcceptanceRadius : DEFAULT_ACCEPTANCE_RADIUS;
    }

    @Override
    public TaskStatus execute(TaskContext context, Map<String, TaskValue> parameters) {
        var targetParam = TaskParams.typed(parameters, PARAM_TARGET, VariableType.VECTOR);
        if (targetParam.isEmpty()) {
            log.warn("Missing or invalid '{}' parameter", PARAM_TARGET);
            return TaskStatus.FAILURE;
        }
        Vector3 target = targetParam.get().asVector();

        // non-positive values fall back to the configured defaults
        float speed = TaskParams.floatOr(parameters, PARAM_SPEED, defaultSpeed);
        if (speed <= 0f) {
            speed = defaultSpeed;
        }
        float radius = TaskParams.floatOr(parameters, PARAM_ACCEPTANCE_RADIUS, defaultAcceptanceRadius);
        if (radius < 0f) {
            radius = defaultAcceptanceRadius;
        }

        if (context.positionSource() != null) {
            return moveInWorld(context, context.positionSource(), target, speed, radius);
        }
        return moveHeadless(context, target, speed, radius);
    }

    private TaskStatus moveInWorld(TaskContext context, PositionSource source, Vector3 target,
                                   float speed, float radius) {
        Vector3 pos = source.position();
        Vector3 delta = target.minus(pos);
        float dist = delta.length();
        log.trace("Entity {} (world) pos={} target={} dist={}", context.entityId(), pos, target, dist);

        if (dist <= radius) {
            source.applyVelocity(Vector3.ZERO);
            log.debug("Entity {} reached {}", context.entityId(), target);
            return TaskStatus.SUCCESS;
        }
        source.applyVelocity(delta.scale(speed / dist));
        return TaskStatus.RUNNING;
    }

    private TaskStatus moveHeadless(TaskContext context, Vector3 target, float speed, float radius) {
        var bb = context.blackboard();
        if (bb == null || bb.declaredType(BB_POSITION) != VariableType.VECTOR) {
            log.warn("No position source: '{}' Vector variable not declared for entity {}",
                    BB_POSITION, context.entityId());
            return TaskStatus.FAILURE;
        }

        Vector3 pos = bb.getValue(BB_POSITION).asVector();
        Vector3 delta = target.minus(pos);
        float dist = delta.length();
        float step = speed * context.deltaTime();
        log.trace("Entity {} pos={} target={} dist={}", context.entityId(), pos, target, dist);

        try {
            if (dist <= radius || dist <= step) {
                bb.setValue(BB_POSITION, TaskValue.ofVector(target));
                log.debug("Entity {} reached {}", context.entityId(), target);
                return TaskStatus.SUCCESS;
            }
            bb.setValue(BB_POSITION, TaskValue.ofVector(pos.plus(delta.scale(step / dist))));
        } catch (BlackboardException e) {
            log.warn("Failed to write '{}': {}", BB_POSITION, e.getMessage());
            return TaskStatus.FAILURE;
        }
        return TaskStatus.RUNNING;
    }
}
