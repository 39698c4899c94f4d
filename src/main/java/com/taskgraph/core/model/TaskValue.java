package com.taskgraph.core.model;

import java.util.Objects;

/**
 * Immutable tagged value exchanged between graph templates, blackboards and tasks.
 * <p>
 * Exactly one variant is active. Callers query {@link #type()} before reading;
 * the typed accessors throw {@link TaskValueTypeException} on a mismatch and
 * never convert between variants (an Int is not readable as a Float).
 */
public final class TaskValue {

    private static final TaskValue NONE = new TaskValue(VariableType.NONE, null);

    private final VariableType type;
    private final Object value;

    private TaskValue(VariableType type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static TaskValue none() {
        return NONE;
    }

    public static TaskValue ofBool(boolean v) {
        return new TaskValue(VariableType.BOOL, v);
    }

    public static TaskValue ofInt(int v) {
        return new TaskValue(VariableType.INT, v);
    }

    public static TaskValue ofFloat(float v) {
        return new TaskValue(VariableType.FLOAT, v);
    }

    public static TaskValue ofVector(Vector3 v) {
        return new TaskValue(VariableType.VECTOR, Objects.requireNonNull(v, "vector"));
    }

    public static TaskValue ofVector(float x, float y, float z) {
        return ofVector(new Vector3(x, y, z));
    }

    /**
     * Entity references are unsigned 64-bit identifiers carried in a {@code long}.
     */
    public static TaskValue ofEntity(long entityId) {
        return new TaskValue(VariableType.ENTITY_ID, entityId);
    }

    public static TaskValue ofString(String v) {
        return new TaskValue(VariableType.STRING, Objects.requireNonNull(v, "string"));
    }

    /**
     * Zero value of a type: false, 0, 0.0, the origin, entity 0 or the empty string.
     */
    public static TaskValue defaultFor(VariableType type) {
        return switch (type) {
            case NONE -> NONE;
            case BOOL -> ofBool(false);
            case INT -> ofInt(0);
            case FLOAT -> ofFloat(0f);
            case VECTOR -> ofVector(Vector3.ZERO);
            case ENTITY_ID -> ofEntity(0L);
            case STRING -> ofString("");
        };
    }

    public VariableType type() {
        return type;
    }

    public boolean isNone() {
        return type == VariableType.NONE;
    }

    public boolean asBool() {
        expect(VariableType.BOOL);
        return (Boolean) value;
    }

    public int asInt() {
        expect(VariableType.INT);
        return (Integer) value;
    }

    public float asFloat() {
        expect(VariableType.FLOAT);
        return (Float) value;
    }

    public Vector3 asVector() {
        expect(VariableType.VECTOR);
        return (Vector3) value;
    }

    public long asEntity() {
        expect(VariableType.ENTITY_ID);
        return (Long) value;
    }

    public String asString() {
        expect(VariableType.STRING);
        return (String) value;
    }

    private void expect(VariableType wanted) {
        if (type != wanted) {
            throw new TaskValueTypeException(wanted, type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskValue other)) return false;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        if (type == VariableType.ENTITY_ID) {
            return "EntityID(" + Long.toUnsignedString((Long) value) + ")";
        }
        return type.displayName() + "(" + value + ")";
    }
}
