package com.taskgraph.core.persistence;

import com.taskgraph.core.blackboard.LocalBlackboard;
import com.taskgraph.core.model.TaskValue;
import com.taskgraph.core.model.VariableType;
import com.taskgraph.core.model.Vector3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;

/**
 * Binary persistence of a {@link LocalBlackboard}.
 * <p>
 * Layout, little-endian:
 * <pre>
 *   u32 count
 *   count x {
 *     u32 nameLen, nameLen bytes UTF-8 name
 *     u8  type tag (see {@link VariableType#tag()})
 *     payload: Bool u8 | Int i32 | Float f32 | Vector 3 x f32 | EntityID u64 | String u32 len + bytes | None (empty)
 *   }
 * </pre>
 * Decoding is schema-tolerant: entries whose name is undeclared or whose tag differs from the
 * declared type are skipped and reported; a truncated or unreadable tail stops decoding without
 * throwing.
 */
public final class BlackboardCodec {

    private static final Logger log = LoggerFactory.getLogger(BlackboardCodec.class);

    private BlackboardCodec() {}

    public static byte[] encode(LocalBlackboard blackboard) {
        var values = blackboard.snapshot();
        var out = new ByteArrayOutputStream();
        writeU32(out, values.size());
        for (var entry : values.entrySet()) {
            writeString(out, entry.getKey());
            TaskValue value = entry.getValue();
            out.write(value.type().tag());
            writePayload(out, value);
        }
        return out.toByteArray();
    }

    public static RestoreReport decode(byte[] bytes, LocalBlackboard blackboard) {
        var skipped = new ArrayList<String>();
        int restored = 0;
        if (bytes == null || bytes.length == 0) {
            return new RestoreReport(0, skipped, true);
        }

        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        long count;
        try {
            count = Integer.toUnsignedLong(buf.getInt());
        } catch (BufferUnderflowException e) {
            log.warn("Blackboard stream too short to hold an entry count ({} bytes)", bytes.length);
            return new RestoreReport(0, skipped, true);
        }

        for (long i = 0; i < count; i++) {
            String name;
            VariableType tagType;
            TaskValue value;
            try {
                name = readString(buf);
                byte tag = buf.get();
                tagType = VariableType.fromTag(tag);
                if (tagType == null) {
                    // payload length unknown, nothing after this point can be located
                    log.warn("Unknown type tag {} for '{}' at entry {}; stopping restore", tag, name, i);
                    skipped.add(name + ": unknown type tag " + tag);
                    return new RestoreReport(restored, skipped, true);
                }
                value = readPayload(buf, tagType);
            } catch (BufferUnderflowException e) {
                log.warn("Blackboard stream truncated at entry {} of {}", i, count);
                return new RestoreReport(restored, skipped, true);
            }

            VariableType declared = blackboard.declaredType(name);
            if (declared == null) {
                log.warn("Skipping unknown variable '{}' during restore", name);
                skipped.add(name + ": not declared");
                continue;
            }
            if (declared != tagType) {
                log.warn("Skipping variable '{}' during restore: stored {} but declared {}",
                        name, tagType.displayName(), declared.displayName());
                skipped.add(name + ": stored " + tagType.displayName() + ", declared " + declared.displayName());
                continue;
            }
            blackboard.setValue(name, value);
            restored++;
        }
        return new RestoreReport(restored, skipped, false);
    }

    private static void writePayload(ByteArrayOutputStream out, TaskValue value) {
        switch (value.type()) {
            case NONE -> { }
            case BOOL -> out.write(value.asBool() ? 1 : 0);
            case INT -> writeU32(out, value.asInt());
            case FLOAT -> writeU32(out, Float.floatToIntBits(value.asFloat()));
            case VECTOR -> {
                Vector3 v = value.asVector();
                writeU32(out, Float.floatToIntBits(v.x()));
                writeU32(out, Float.floatToIntBits(v.y()));
                writeU32(out, Float.floatToIntBits(v.z()));
            }
            case ENTITY_ID -> {
                long id = value.asEntity();
                writeU32(out, (int) id);
                writeU32(out, (int) (id >>> 32));
            }
            case STRING -> writeString(out, value.asString());
        }
    }

    private static TaskValue readPayload(ByteBuffer buf, VariableType type) {
        return switch (type) {
            case NONE -> TaskValue.none();
            case BOOL -> TaskValue.ofBool(buf.get() != 0);
            case INT -> TaskValue.ofInt(buf.getInt());
            case FLOAT -> TaskValue.ofFloat(buf.getFloat());
            case VECTOR -> {
                float x = buf.getFloat();
                float y = buf.getFloat();
                float z = buf.getFloat();
                yield TaskValue.ofVector(x, y, z);
            }
            case ENTITY_ID -> TaskValue.ofEntity(buf.getLong());
            case STRING -> TaskValue.ofString(readString(buf));
        };
    }

    private static void writeU32(ByteArrayOutputStream out, int v) {
        out.write(v & 0xFF);
        out.write((v >>> 8) & 0xFF);
        out.write((v >>> 16) & 0xFF);
        out.write((v >>> 24) & 0xFF);
    }

    private static void writeString(ByteArrayOutputStream out, String s) {
        byte[] raw = s.getBytes(StandardCharsets.UTF_8);
        writeU32(out, raw.length);
        out.writeBytes(raw);
    }

    private static String readString(ByteBuffer buf) {
        long len = Integer.toUnsignedLong(buf.getInt());
        if (len > buf.remaining()) {
            throw new BufferUnderflowException();
        }
        byte[] raw = new byte[(int) len];
        buf.get(raw);
        return new String(raw, StandardCharsets.UTF_8);
    }
}
