package com.taskgraph.core.tasks.builtin;

import com.taskgraph.core.blackboard.BlackboardException;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.model.TaskValue;
import com.taskgraph.core.model.VariableType;
import com.taskgraph.core.tasks.AtomicTask;
import com.taskgraph.core.tasks.TaskContext;
import com.taskgraph.core.tasks.TaskParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Writes {@code Value} into the blackboard variable named by {@code VarName}.
 * Fails on missing parameters, a non-string name, an unknown variable or a type mismatch.
 */
public class SetVariableTask implements AtomicTask {

    private static final Logger log = LoggerFactory.getLogger(SetVariableTask.class);

    public static final String ID = "SetVariable";
    public static final String PARAM_VAR_NAME = "VarName";
    public static final String PARAM_VALUE = "Value";

    @Override
    public TaskStatus execute(TaskContext context, Map<String, TaskValue> parameters) {
        var nameParam = TaskParams.typed(parameters, PARAM_VAR_NAME, VariableType.STRING);
        if (nameParam.isEmpty()) {
            log.warn("Missing or invalid '{}' parameter", PARAM_VAR_NAME);
            return TaskStatus.FAILURE;
        }
        String varName = nameParam.get().asString();

        var value = TaskParams.present(parameters, PARAM_VALUE);
        if (value.isEmpty()) {
            log.warn("Missing '{}' parameter for variable '{}'", PARAM_VALUE, varName);
            return TaskStatus.FAILURE;
        }

        if (context.blackboard() == null) {
            log.warn("No blackboard available to set '{}'", varName);
            return TaskStatus.FAILURE;
        }

        try {
            context.blackboard().setValue(varName, value.get());
        } catch (BlackboardException e) {
            log.warn("Failed to set '{}': {}", varName, e.getMessage());
            return TaskStatus.FAILURE;
        }

        log.debug("Entity {} set '{}' = {}", context.entityId(), varName, value.get());
        return TaskStatus.SUCCESS;
    }
}
