package com.taskgraph.core.blackboard;

import com.taskgraph.core.graph.TaskGraphTemplate;
import com.taskgraph.core.model.TaskValue;
import com.taskgraph.core.model.VariableDefinition;
import com.taskgraph.core.model.VariableType;
import com.taskgraph.core.persistence.BlackboardCodec;
import com.taskgraph.core.persistence.RestoreReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed named-variable store owned by exactly one runner.
 * <p>
 * The schema (names, types, defaults) comes from a template's variable
 * declarations. Every stored value carries its declared type at all times:
 * writes of another type are rejected, never coerced. Not thread-safe; a
 * blackboard is only touched by the runner that owns it.
 */
public class LocalBlackboard {

    private static final Logger log = LoggerFactory.getLogger(LocalBlackboard.class);

    private final Map<String, VariableType> types = new LinkedHashMap<>();
    private final Map<String, TaskValue> defaults = new LinkedHashMap<>();
    private final Map<String, TaskValue> values = new LinkedHashMap<>();

    /**
     * Replaces all state with the template's declarations; current values start at their defaults.
     */
    public void initialize(TaskGraphTemplate template) {
        initialize(template.variables());
        log.debug("Initialized {} variables from template '{}'", values.size(), template.name());
    }

    public void initialize(List<VariableDefinition> declarations) {
        types.clear();
        defaults.clear();
        values.clear();
        for (var def : declarations) {
            types.put(def.name(), def.type());
            defaults.put(def.name(), def.defaultValue());
            values.put(def.name(), def.defaultValue());
        }
    }

    /**
     * @throws BlackboardException if the variable was never declared
     */
    public TaskValue getValue(String name) {
        TaskValue value = values.get(name);
        if (value == null) {
            throw BlackboardException.unknownVariable(name);
        }
        return value;
    }

    /**
     * Replaces a variable's value.
     *
     * @throws BlackboardException if the variable is undeclared or {@code value} has a different type
     */
    public void setValue(String name, TaskValue value) {
        VariableType declared = types.get(name);
        if (declared == null) {
            throw BlackboardException.unknownVariable(name);
        }
        if (value == null || value.type() != declared) {
            throw new BlackboardException("Type mismatch for variable '" + name + "': declared "
                    + declared.displayName() + ", got " + (value == null ? "null" : value.type().displayName()));
        }
        values.put(name, value);
    }

    /**
     * Restores every variable to its declared default. The set of names is unchanged.
     */
    public void reset() {
        values.putAll(defaults);
        log.debug("Blackboard reset to defaults ({} variables)", values.size());
    }

    public boolean hasVariable(String name) {
        return types.containsKey(name);
    }

    /**
     * @return the declared type, or {@code null} for an undeclared name
     */
    public VariableType declaredType(String name) {
        return types.get(name);
    }

    public List<String> getVariableNames() {
        return List.copyOf(types.keySet());
    }

    public int size() {
        return values.size();
    }

    /**
     * Read-only copy of the current values, in declaration order.
     */
    public Map<String, TaskValue> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public byte[] serialize() {
        return BlackboardCodec.encode(this);
    }

    /**
     * Restores values from {@link #serialize()} output. The schema must already be initialized;
     * entries unknown to it or of the wrong type are skipped and reported.
     */
    public RestoreReport deserialize(byte[] bytes) {
        return BlackboardCodec.decode(bytes, this);
    }
}
