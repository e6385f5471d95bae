// file: storage/src/main/java/io/hybriddb/storage/RecordCodec.java
package io.hybriddb.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.hybriddb.core.Document;
import io.hybriddb.core.Json;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xD17E   (helps detect garbage)
 *     - version (1B)  = 2
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes)]
 *     UTF-8 JSON: {"puts": [entry, ...], "removes": [id, ...]}
 *     entry = {"id": ..., "state": "CACHED|UPSERTED|REMOVED", "doc": {...}, "base": {...}}
 * <p>
 * One record holds one persist() call, so a batch is replayed all-or-nothing.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xD17E;
    static final byte VERSION = 2;
    static final int HEADER_LEN = 2 + 1 + 4 + 4;

    private RecordCodec() {}

    /** Decoded record: one persist() batch. */
    record LogRecord(List<StoredEntry> puts, List<String> removes) {
        LogRecord {
            puts = puts == null ? List.of() : puts;
            removes = removes == null ? List.of() : removes;
        }
    }

    /** JSON shape of a {@link CollectionEntry}. */
    record StoredEntry(String id, CollectionEntry.State state, Document doc, Document base) {

        static StoredEntry of(CollectionEntry e) {
            return new StoredEntry(e.id(), e.state(), e.doc(), e.base());
        }

        CollectionEntry toEntry() {
            return new CollectionEntry(id, state, doc, base);
        }
    }

    /** Encode a batch into header+payload bytes ready for append. */
    static byte[] encode(List<CollectionEntry> puts, List<String> removedIds) throws IOException {
        List<StoredEntry> stored = new ArrayList<>(puts.size());
        for (CollectionEntry e : puts) stored.add(StoredEntry.of(e));
        byte[] payload = Json.MAPPER.writeValueAsBytes(new LogRecord(stored, removedIds));

        ByteBuffer out = ByteBuffer.allocate(HEADER_LEN + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /**
     * Decode a full payload (not including header).
     *
     * @throws IOException when a CRC-valid payload is not a valid record
     */
    static LogRecord decode(byte[] payload) throws IOException {
        try {
            LogRecord rec = Json.MAPPER.readValue(payload, LogRecord.class);
            for (StoredEntry e : rec.puts()) {
                if (e.id() == null || e.state() == null) throw new IOException("WAL entry without id or state");
                if (e.state() != CollectionEntry.State.REMOVED && e.doc() == null) {
                    throw new IOException("WAL entry " + e.id() + " has no document");
                }
            }
            return rec;
        } catch (JsonProcessingException e) {
            throw new IOException("undecodable WAL record", e);
        }
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }
}
