package com.taskgraph.core.tasks.builtin;

import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.model.TaskValue;
import com.taskgraph.core.model.VariableType;
import com.taskgraph.core.model.Vector3;
import com.taskgraph.core.tasks.AtomicTask;
import com.taskgraph.core.tasks.TaskContext;
import com.taskgraph.core.tasks.TaskParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Compares {@code LHS} with {@code RHS} using {@code Operator}.
 * <p>
 * {@code ==} and {@code !=} work on any two values of the same type; the ordering
 * operators only on Int and Float. Float comparison is exact. Succeeds when the
 * comparison holds and fails otherwise, including on mismatched operand types or an
 * unknown operator.
 */
public class CompareTask implements AtomicTask {

    private static final Logger log = LoggerFactory.getLogger(CompareTask.class);

    public static final String ID = "Compare";
    public static final String PARAM_LHS = "LHS";
    public static final String PARAM_RHS = "RHS";
    public static final String PARAM_OPERATOR = "Operator";

    @Override
    public TaskStatus execute(TaskContext context, Map<String, TaskValue> parameters) {
        var opParam = TaskParams.typed(parameters, PARAM_OPERATOR, VariableType.STRING);
        if (opParam.isEmpty()) {
            log.warn("Missing or invalid '{}' parameter", PARAM_OPERATOR);
            return TaskStatus.FAILURE;
        }
        String op = opParam.get().asString();

        var lhs = TaskParams.present(parameters, PARAM_LHS);
        var rhs = TaskParams.present(parameters, PARAM_RHS);
        if (lhs.isEmpty() || rhs.isEmpty()) {
            log.warn("Missing '{}' or '{}' parameter", PARAM_LHS, PARAM_RHS);
            return TaskStatus.FAILURE;
        }
        if (lhs.get().type() != rhs.get().type()) {
            log.warn("Operand type mismatch: {} vs {}", lhs.get().type().displayName(), rhs.get().type().displayName());
            return TaskStatus.FAILURE;
        }

        Boolean result = compare(lhs.get(), rhs.get(), op);
        if (result == null) {
            log.warn("Operator '{}' not supported for {} operands", op, lhs.get().type().displayName());
            return TaskStatus.FAILURE;
        }
        log.debug("{} {} {} -> {}", lhs.get(), op, rhs.get(), result);
        return result ? TaskStatus.SUCCESS : TaskStatus.FAILURE;
    }

    /**
     * @return the comparison result, or null when the operator is invalid for the operand type
     */
    static Boolean compare(TaskValue lhs, TaskValue rhs, String op) {
        switch (op) {
            case "==":
                return valuesEqual(lhs, rhs);
            case "!=":
                return !valuesEqual(lhs, rhs);
            case "<":
            case "<=":
            case ">":
            case ">=":
                break;
            default:
                return null;
        }

        int cmp;
        if (lhs.type() == VariableType.INT) {
            cmp = Integer.compare(lhs.asInt(), rhs.asInt());
        } else if (lhs.type() == VariableType.FLOAT) {
            float l = lhs.asFloat();
            float r = rhs.asFloat();
            if (Float.isNaN(l) || Float.isNaN(r)) {
                return false;
            }
            cmp = l < r ? -1 : (l > r ? 1 : 0);
        } else {
            return null;
        }

        return switch (op) {
            case "<" -> cmp < 0;
            case "<=" -> cmp <= 0;
            case ">" -> cmp > 0;
            default -> cmp >= 0;
        };
    }

    /**
     * Floats and vector components use primitive {@code ==}: {@code 0.0 == -0.0} holds and NaN equals nothing.
     */
    private static boolean valuesEqual(TaskValue lhs, TaskValue rhs) {
        if (lhs.type() == VariableType.FLOAT) {
            return lhs.asFloat() == rhs.asFloat();
        }
        if (lhs.type() == VariableType.VECTOR) {
            Vector3 l = lhs.asVector();
            Vector3 r = rhs.asVector();
            return l.x() == r.x() && l.y() == r.y() && l.z() == r.z();
        }
        return lhs.equals(rhs);
    }
}
