// file: src/main/java/io/strata/storage/RecordCodec.java
package io.strata.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Binary framing for journal records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x57A7   (helps detect garbage)
 *     - version (1B)  = 1        (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - lsn:   int64 log sequence number, strictly increasing per journal
 *     - kind:  int32 len + UTF-8 bytes (record type, e.g. "append-state")
 *     - body:  int32 len + bytes (JSON document for that kind)
 * <p>
 * The header is validated by magic/version/length and CRC when reading.
 * The payload is decoded into a (lsn, kind, body) triple.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x57A7;
    static final byte  VERSION = 1;
    static final int   HEADER_BYTES = 11;

    /** Immutable view of a decoded record. */
    record LogRecord(long lsn, String kind, byte[] body) {}

    private RecordCodec() {
    }

    /** Encode a log record into header+payload bytes ready for append. */
    static byte[] encode(long lsn, String kind, byte[] body) {
        byte[] payload = encodePayload(lsn, kind, body);
        return frame(payload);
    }

    /** Prefix a payload with the 11-byte header. */
    static byte[] frame(byte[] payload) {
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /**
     * Validate a header+payload frame and return the payload, or null when the frame is
     * short, carries a foreign magic/version, or fails its CRC.
     */
    static byte[] unframe(byte[] framed) {
        if (framed.length < HEADER_BYTES) return null;
        ByteBuffer b = ByteBuffer.wrap(framed).order(ByteOrder.LITTLE_ENDIAN);
        short magic = b.getShort();
        byte ver = b.get();
        int len = b.getInt();
        int crc = b.getInt();
        if (magic != MAGIC || ver != VERSION || len < 0 || len != framed.length - HEADER_BYTES) return null;
        byte[] payload = new byte[len];
        b.get(payload);
        return crc32(payload) == crc ? payload : null;
    }

    /** Decode a full payload (not including header). */
    static LogRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        long lsn = b.getLong();
        String kind = new String(readBytes(b), StandardCharsets.UTF_8);
        byte[] body = readBytes(b);
        return new LogRecord(lsn, kind, body);
    }

    // ----------------- helpers -----------------

    private static byte[] encodePayload(long lsn, String kind, byte[] body) {
        byte[] sKind = kind.getBytes(StandardCharsets.UTF_8);
        int size = 8 + 4 + sKind.length + 4 + body.length;

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.putLong(lsn);
        b.putInt(sKind.length).put(sKind);
        b.putInt(body.length).put(body);
        return b.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue(); // CRC32 fits in unsigned int; Java int is fine for compare
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) throw new IllegalStateException("corrupt record payload");
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }
}
