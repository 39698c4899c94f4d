package com.taskgraph.core.model;

/**
 * Type tag of a {@link TaskValue}.
 * <p>
 * The {@link #tag()} byte is written by the blackboard persistence format and
 * must never be renumbered.
 */
public enum VariableType {
    NONE((byte) 0),
    BOOL((byte) 1),
    INT((byte) 2),
    FLOAT((byte) 3),
    VECTOR((byte) 4),
    ENTITY_ID((byte) 5),
    STRING((byte) 6);

    private final byte tag;

    VariableType(byte tag) {
        this.tag = tag;
    }

    public byte tag() {
        return tag;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }

    /**
     * Resolves a wire tag back to its type.
     *
     * @return the matching type, or {@code null} for an unknown tag
     */
    public static VariableType fromTag(byte tag) {
        for (VariableType type : values()) {
            if (type.tag == tag) {
                return type;
            }
        }
        return null;
    }

    /**
     * Parses the names used in graph files ("Bool", "Int", "Float", "Vector", "EntityID", "String").
     * Unknown names map to {@link #NONE}.
     */
    public static VariableType fromName(String name) {
        if (name == null) {
            return NONE;
        }
        return switch (name) {
            case "Bool" -> BOOL;
            case "Int" -> INT;
            case "Float" -> FLOAT;
            case "Vector" -> VECTOR;
            case "EntityID" -> ENTITY_ID;
            case "String" -> STRING;
            default -> NONE;
        };
    }

    public String displayName() {
        return switch (this) {
            case NONE -> "None";
            case BOOL -> "Bool";
            case INT -> "Int";
            case FLOAT -> "Float";
            case VECTOR -> "Vector";
            case ENTITY_ID -> "EntityID";
            case STRING -> "String";
        };
    }
}
