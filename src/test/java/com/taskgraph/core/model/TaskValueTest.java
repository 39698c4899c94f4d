package com.taskgraph.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskValueTest {

    @Nested
    @DisplayName("typed access")
    class TypedAccess {

        @Test
        @DisplayName("each factory sets its type tag")
        void factoriesSetType() {
            assertEquals(VariableType.BOOL, TaskValue.ofBool(true).type());
            assertEquals(VariableType.INT, TaskValue.ofInt(3).type());
            assertEquals(VariableType.FLOAT, TaskValue.ofFloat(1.5f).type());
            assertEquals(VariableType.VECTOR, TaskValue.ofVector(1, 2, 3).type());
            assertEquals(VariableType.ENTITY_ID, TaskValue.ofEntity(9L).type());
            assertEquals(VariableType.STRING, TaskValue.ofString("x").type());
            assertTrue(TaskValue.none().isNone());
        }

        @Test
        @DisplayName("accessor of the active variant returns the value")
        void matchingAccessor() {
            assertTrue(TaskValue.ofBool(true).asBool());
            assertEquals(-4, TaskValue.ofInt(-4).asInt());
            assertEquals(0.25f, TaskValue.ofFloat(0.25f).asFloat());
            assertEquals(new Vector3(1, 2, 3), TaskValue.ofVector(1, 2, 3).asVector());
            assertEquals(-1L, TaskValue.ofEntity(-1L).asEntity());
            assertEquals("hello", TaskValue.ofString("hello").asString());
        }

        @Test
        @DisplayName("Int is not readable as Float")
        void noConversion() {
            var ex = assertThrows(TaskValueTypeException.class, () -> TaskValue.ofInt(5).asFloat());
            assertEquals(VariableType.FLOAT, ex.expected());
            assertEquals(VariableType.INT, ex.actual());
        }

        @Test
        @DisplayName("None rejects every accessor")
        void noneRejectsAccess() {
            assertThrows(TaskValueTypeException.class, () -> TaskValue.none().asBool());
            assertThrows(TaskValueTypeException.class, () -> TaskValue.none().asString());
        }
    }

    @Test
    @DisplayName("defaultFor yields the zero value of each type")
    void defaults() {
        assertFalse(TaskValue.defaultFor(VariableType.BOOL).asBool());
        assertEquals(0, TaskValue.defaultFor(VariableType.INT).asInt());
        assertEquals(0f, TaskValue.defaultFor(VariableType.FLOAT).asFloat());
        assertEquals(Vector3.ZERO, TaskValue.defaultFor(VariableType.VECTOR).asVector());
        assertEquals(0L, TaskValue.defaultFor(VariableType.ENTITY_ID).asEntity());
        assertEquals("", TaskValue.defaultFor(VariableType.STRING).asString());
        assertTrue(TaskValue.defaultFor(VariableType.NONE).isNone());
    }

    @Test
    @DisplayName("equality requires the same type and value")
    void equality() {
        assertEquals(TaskValue.ofInt(1), TaskValue.ofInt(1));
        assertEquals(TaskValue.ofInt(1).hashCode(), TaskValue.ofInt(1).hashCode());
        assertNotEquals(TaskValue.ofInt(1), TaskValue.ofFloat(1f));
        assertNotEquals(TaskValue.ofString("a"), TaskValue.ofString("b"));
    }

    @Test
    @DisplayName("entity ids print unsigned")
    void entityToString() {
        assertEquals("EntityID(18446744073709551615)", TaskValue.ofEntity(-1L).toString());
    }

    @Test
    @DisplayName("type tags and names resolve both ways")
    void variableTypeLookups() {
        for (VariableType type : VariableType.values()) {
            assertEquals(type, VariableType.fromTag(type.tag()));
        }
        assertNull(VariableType.fromTag((byte) 42));
        assertEquals(VariableType.ENTITY_ID, VariableType.fromName("EntityID"));
        assertEquals(VariableType.NONE, VariableType.fromName("Quaternion"));
    }
}
