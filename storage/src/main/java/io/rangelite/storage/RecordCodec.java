// file: storage/src/main/java/io/rangelite/storage/RecordCodec.java
package io.rangelite.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records. One record is one committed write batch.
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xD17E
 *     - version (1B)  = 2
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - opCount: int32
 *         repeated opCount times:
 *           - kind:  byte (0 = put, 1 = delete)
 *           - key:   int32 len + UTF-8 bytes
 *           - value: int32 len + bytes (len == -1 for deletes)
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xD17E;
    static final byte  VERSION = 2;

    private static final byte PUT = 0;
    private static final byte DELETE = 1;

    /** Encode a batch into header+payload bytes ready for append. */
    static byte[] encode(List<WriteBatch.Op> ops) {
        byte[] payload = encodePayload(ops);
        ByteBuffer out = ByteBuffer.allocate(11 + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Decode a full payload (not including header). */
    static List<WriteBatch.Op> decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        int count = b.getInt();
        List<WriteBatch.Op> ops = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            byte kind = b.get();
            String key = readString(b);
            byte[] value = readBytes(b);
            if (kind == PUT) {
                ops.add(new WriteBatch.Op(key, value));
            } else if (kind == DELETE) {
                ops.add(new WriteBatch.Op(key, null));
            } else {
                throw new IllegalStateException("unknown batch op kind " + kind);
            }
        }
        return ops;
    }

    /** Validate a full record and return its payload, or null if it is corrupt. */
    static byte[] payloadOf(byte[] record) {
        if (record.length < 11) return null;
        ByteBuffer b = ByteBuffer.wrap(record).order(ByteOrder.LITTLE_ENDIAN);
        if (b.getShort() != MAGIC || b.get() != VERSION) return null;
        int len = b.getInt();
        int crc = b.getInt();
        if (len < 0 || len != record.length - 11) return null;
        byte[] payload = new byte[len];
        b.get(payload);
        return crc32(payload) == crc ? payload : null;
    }

    private static byte[] encodePayload(List<WriteBatch.Op> ops) {
        int size = 4;
        List<byte[]> keys = new ArrayList<>(ops.size());
        for (WriteBatch.Op op : ops) {
            byte[] k = op.key().getBytes(StandardCharsets.UTF_8);
            keys.add(k);
            size += 1 + 4 + k.length + 4 + (op.value() == null ? 0 : op.value().length);
        }
        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.putInt(ops.size());
        for (int i = 0; i < ops.size(); i++) {
            WriteBatch.Op op = ops.get(i);
            b.put(op.isDelete() ? DELETE : PUT);
            writeBytes(b, keys.get(i));
            writeBytes(b, op.value());
        }
        return b.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        if (data == null) { b.putInt(-1); return; }
        b.putInt(data.length).put(data);
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len == -1) return null;
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }

    private static String readString(ByteBuffer b) {
        byte[] s = readBytes(b);
        if (s == null) throw new IllegalStateException("null key in WAL record");
        return new String(s, StandardCharsets.UTF_8);
    }
}
