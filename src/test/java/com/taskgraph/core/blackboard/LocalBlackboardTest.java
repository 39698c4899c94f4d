package com.taskgraph.core.blackboard;

import com.taskgraph.core.graph.TaskGraphTemplate;
import com.taskgraph.core.graph.TaskNodeDefinition;
import com.taskgraph.core.model.TaskValue;
import com.taskgraph.core.model.VariableDefinition;
import com.taskgraph.core.model.VariableType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LocalBlackboardTest {

    private static final List<VariableDefinition> DECLARATIONS = List.of(
            VariableDefinition.of("Alive", TaskValue.ofBool(true)),
            VariableDefinition.of("Ammo", TaskValue.ofInt(12)),
            VariableDefinition.of("Speed", TaskValue.ofFloat(2.5f)),
            VariableDefinition.of("Home", TaskValue.ofVector(1, 2, 3)),
            VariableDefinition.of("Target", TaskValue.ofEntity(40L)),
            VariableDefinition.of("Mood", TaskValue.ofString("calm"))
    );

    private LocalBlackboard blackboard;

    @BeforeEach
    void setUp() {
        blackboard = new LocalBlackboard();
        blackboard.initialize(DECLARATIONS);
    }

    @Nested
    @DisplayName("initialize")
    class Initialize {

        @Test
        @DisplayName("every declared variable starts at its default with its declared type")
        void defaultsAfterInitialize() {
            for (VariableDefinition def : DECLARATIONS) {
                TaskValue value = blackboard.getValue(def.name());
                assertEquals(def.defaultValue(), value);
                assertEquals(def.type(), value.type());
            }
            assertEquals(6, blackboard.size());
        }

        @Test
        @DisplayName("re-initializing from a template discards the old schema")
        void reinitializeFromTemplate() {
            blackboard.setValue("Ammo", TaskValue.ofInt(1));
            var template = new TaskGraphTemplate("Other",
                    List.of(new VariableDefinition("Flag", VariableType.BOOL, null)),
                    List.of(TaskNodeDefinition.atomic(0, "only", "LogMessage", Map.of(), -1, -1)),
                    0);

            blackboard.initialize(template);

            assertEquals(List.of("Flag"), blackboard.getVariableNames());
            assertFalse(blackboard.hasVariable("Ammo"));
            assertFalse(blackboard.getValue("Flag").asBool());
        }
    }

    @Nested
    @DisplayName("getValue / setValue")
    class GetAndSet {

        @Test
        @DisplayName("type-matched writes are read back")
        void matchedWrite() {
            blackboard.setValue("Ammo", TaskValue.ofInt(3));
            blackboard.setValue("Mood", TaskValue.ofString("angry"));

            assertEquals(3, blackboard.getValue("Ammo").asInt());
            assertEquals("angry", blackboard.getValue("Mood").asString());
        }

        @Test
        @DisplayName("type-mismatched write fails and keeps the stored value")
        void mismatchedWrite() {
            assertThrows(BlackboardException.class, () -> blackboard.setValue("Ammo", TaskValue.ofFloat(3f)));
            assertThrows(BlackboardException.class, () -> blackboard.setValue("Ammo", null));
            assertEquals(12, blackboard.getValue("Ammo").asInt());
        }

        @Test
        @DisplayName("undeclared names are rejected on read and write")
        void undeclaredName() {
            var ex = assertThrows(BlackboardException.class, () -> blackboard.getValue("Ghost"));
            assertTrue(ex.getMessage().contains("Ghost"));
            assertThrows(BlackboardException.class, () -> blackboard.setValue("Ghost", TaskValue.ofInt(1)));
            assertFalse(blackboard.hasVariable("Ghost"));
        }
    }

    @Test
    @DisplayName("reset restores defaults and keeps the declared names")
    void reset() {
        blackboard.setValue("Alive", TaskValue.ofBool(false));
        blackboard.setValue("Home", TaskValue.ofVector(9, 9, 9));
        blackboard.setValue("Target", TaskValue.ofEntity(1L));

        blackboard.reset();

        for (VariableDefinition def : DECLARATIONS) {
            assertEquals(def.defaultValue(), blackboard.getValue(def.name()));
        }
        assertEquals(List.of("Alive", "Ammo", "Speed", "Home", "Target", "Mood"), blackboard.getVariableNames());
    }

    @Test
    @DisplayName("snapshot is a detached read-only copy")
    void snapshot() {
        Map<String, TaskValue> snapshot = blackboard.snapshot();
        blackboard.setValue("Ammo", TaskValue.ofInt(0));

        assertEquals(12, snapshot.get("Ammo").asInt());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("Ammo", TaskValue.ofInt(1)));
    }
}
