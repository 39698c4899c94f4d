package com.taskgraph.core.persistence;

import com.taskgraph.core.blackboard.LocalBlackboard;
import com.taskgraph.core.model.TaskValue;
import com.taskgraph.core.model.VariableDefinition;
import com.taskgraph.core.model.VariableType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlackboardCodecTest {

    private static final List<VariableDefinition> SCHEMA = List.of(
            new VariableDefinition("Alive", VariableType.BOOL, null),
            new VariableDefinition("Ammo", VariableType.INT, null),
            new VariableDefinition("Speed", VariableType.FLOAT, null),
            new VariableDefinition("Home", VariableType.VECTOR, null),
            new VariableDefinition("Target", VariableType.ENTITY_ID, null),
            new VariableDefinition("Mood", VariableType.STRING, null)
    );

    private LocalBlackboard source;

    @BeforeEach
    void setUp() {
        source = new LocalBlackboard();
        source.initialize(SCHEMA);
        source.setValue("Alive", TaskValue.ofBool(true));
        source.setValue("Ammo", TaskValue.ofInt(-7));
        source.setValue("Speed", TaskValue.ofFloat(3.25f));
        source.setValue("Home", TaskValue.ofVector(1.5f, -2f, 1e6f));
        source.setValue("Target", TaskValue.ofEntity(0xFEDCBA9876543210L));
        source.setValue("Mood", TaskValue.ofString("héllo wörld"));
    }

    @Test
    @DisplayName("round-trip into the same schema reproduces every value")
    void roundTrip() {
        byte[] bytes = source.serialize();

        var restored = new LocalBlackboard();
        restored.initialize(SCHEMA);
        RestoreReport report = restored.deserialize(bytes);

        assertTrue(report.clean());
        assertEquals(6, report.restored());
        assertEquals(source.snapshot(), restored.snapshot());
    }

    @Nested
    @DisplayName("wire layout")
    class WireLayout {

        @Test
        @DisplayName("count, name, tag and payload are little-endian")
        void singleIntEntry() {
            var bb = new LocalBlackboard();
            bb.initialize(List.of(VariableDefinition.of("N", TaskValue.ofInt(0x01020304))));

            byte[] bytes = bb.serialize();

            ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
            assertEquals(1, buf.getInt());
            assertEquals(1, buf.getInt());
            assertEquals('N', buf.get());
            assertEquals(VariableType.INT.tag(), buf.get());
            assertEquals(0x01020304, buf.getInt());
            assertFalse(buf.hasRemaining());
            assertEquals(0x04, bytes[bytes.length - 4]);
        }

        @Test
        @DisplayName("entity ids use eight bytes and strings a length prefix")
        void entityAndString() {
            var bb = new LocalBlackboard();
            bb.initialize(List.of(
                    VariableDefinition.of("E", TaskValue.ofEntity(5L)),
                    VariableDefinition.of("S", TaskValue.ofString("ab"))));

            ByteBuffer buf = ByteBuffer.wrap(bb.serialize()).order(ByteOrder.LITTLE_ENDIAN);
            assertEquals(2, buf.getInt());
            buf.getInt();
            buf.get();
            assertEquals(VariableType.ENTITY_ID.tag(), buf.get());
            assertEquals(5L, buf.getLong());
            buf.getInt();
            buf.get();
            assertEquals(VariableType.STRING.tag(), buf.get());
            assertEquals(2, buf.getInt());
            byte[] raw = new byte[2];
            buf.get(raw);
            assertEquals("ab", new String(raw, StandardCharsets.UTF_8));
        }
    }

    @Nested
    @DisplayName("schema tolerance")
    class SchemaTolerance {

        @Test
        @DisplayName("entries unknown to the target schema are skipped and known ones restored")
        void unknownNamesSkipped() {
            var target = new LocalBlackboard();
            target.initialize(List.of(
                    new VariableDefinition("Ammo", VariableType.INT, null),
                    new VariableDefinition("Mood", VariableType.STRING, null)));

            RestoreReport report = assertDoesNotThrow(() -> target.deserialize(source.serialize()));

            assertEquals(2, report.restored());
            assertEquals(4, report.skipped().size());
            assertFalse(report.truncated());
            assertEquals(-7, target.getValue("Ammo").asInt());
            assertEquals("héllo wörld", target.getValue("Mood").asString());
        }

        @Test
        @DisplayName("entries whose tag differs from the declared type are skipped")
        void mismatchedTypeSkipped() {
            var target = new LocalBlackboard();
            target.initialize(List.of(
                    new VariableDefinition("Ammo", VariableType.FLOAT, null),
                    new VariableDefinition("Alive", VariableType.BOOL, null)));

            RestoreReport report = target.deserialize(source.serialize());

            assertEquals(1, report.restored());
            assertTrue(report.skipped().stream().anyMatch(s -> s.startsWith("Ammo")));
            assertEquals(0f, target.getValue("Ammo").asFloat());
            assertTrue(target.getValue("Alive").asBool());
        }
    }

    @Nested
    @DisplayName("malformed input")
    class MalformedInput {

        @Test
        @DisplayName("a truncated stream keeps the entries decoded before the cut")
        void truncated() {
            byte[] bytes = source.serialize();
            byte[] cut = Arrays.copyOf(bytes, bytes.length - 3);

            var target = new LocalBlackboard();
            target.initialize(SCHEMA);
            RestoreReport report = assertDoesNotThrow(() -> target.deserialize(cut));

            assertTrue(report.truncated());
            assertEquals(5, report.restored());
            assertEquals(-7, target.getValue("Ammo").asInt());
            assertEquals("", target.getValue("Mood").asString());
        }

        @Test
        @DisplayName("empty and tiny inputs are reported as truncated")
        void emptyInput() {
            var target = new LocalBlackboard();
            target.initialize(SCHEMA);

            assertTrue(target.deserialize(new byte[0]).truncated());
            assertTrue(target.deserialize(new byte[]{1, 0}).truncated());
            assertTrue(target.deserialize(null).truncated());
        }

        @Test
        @DisplayName("an unknown type tag stops decoding")
        void unknownTag() {
            ByteBuffer buf = ByteBuffer.allocate(4 + 4 + 1 + 1 + 4).order(ByteOrder.LITTLE_ENDIAN);
            buf.putInt(2).putInt(1).put((byte) 'X').put((byte) 99).putInt(0);

            var target = new LocalBlackboard();
            target.initialize(SCHEMA);
            RestoreReport report = target.deserialize(buf.array());

            assertTrue(report.truncated());
            assertEquals(0, report.restored());
            assertEquals(1, report.skipped().size());
        }

        @Test
        @DisplayName("a string length beyond the buffer is treated as truncation")
        void oversizedLength() {
            ByteBuffer buf = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN);
            buf.putInt(1).putInt(Integer.MAX_VALUE);

            var target = new LocalBlackboard();
            target.initialize(SCHEMA);

            assertTrue(target.deserialize(buf.array()).truncated());
        }
    }
}
