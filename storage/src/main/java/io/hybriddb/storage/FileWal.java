// file: storage/src/main/java/io/hybriddb/storage/FileWal.java
package io.hybriddb.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment ("00000001.log", "00000002.log", ...),
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - on failure, truncates the segment back to where the record started,
 *      - tracks bytes written this segment.
 * <p>
 *  - rotateIfNeeded():
 *      - when written bytes >= rotateBytes, closes current segment and opens
 *        a new one with incremented index, resetting the counter.
 * <p>
 *  - Reader:
 *      - walks every segment in name order,
 *      - reads the fixed-size header, validates magic/version/length,
 *      - reads the payload and validates its CRC,
 *      - stops at the first truncated header/payload or bad CRC.
 */
final class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());
    private static final String FIRST_SEGMENT = "00000001.log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    FileWal(Path dir, long rotateBytes) throws IOException {
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        Files.createDirectories(dir);
        openNewestOrCreate();
    }

    @Override
    public void append(byte[] serializedRecord) throws IOException {
        long start = ch.position();
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) ch.write(buf);
            ch.force(true);
        } catch (IOException e) {
            rollBack(start, e);
            throw e;
        }
        writtenInSegment += serializedRecord.length;
    }

    /** Cuts a partial record off so the next append is not stranded behind a tear. */
    private void rollBack(long start, IOException cause) {
        try {
            ch.truncate(start);
            ch.position(start);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    @Override
    public void rotateIfNeeded() throws IOException {
        if (writtenInSegment < rotateBytes) return;
        ch.close();
        int index = Integer.parseInt(current.getFileName().toString().replace(".log", ""));
        current = dir.resolve(String.format("%08d.log", index + 1));
        ch = FileChannel.open(current, CREATE, WRITE, READ);
        writtenInSegment = 0;
        log.fine(() -> "WAL rotated to " + current);
    }

    @Override
    public void truncate() throws IOException {
        ch.close();
        try {
            for (Path seg : segments(dir)) Files.delete(seg);
            current = dir.resolve(FIRST_SEGMENT);
        } finally {
            // Reopen even when a delete failed so later appends still have a segment.
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = ch.size();
            ch.position(writtenInSegment);
        }
    }

    @Override
    public WalReader openReader() throws IOException {
        return new Reader(segments(dir));
    }

    @Override
    public void close() throws IOException {
        if (ch != null) ch.close();
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one and position at the end.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() throws IOException {
        List<Path> segs = segments(dir);
        current = segs.isEmpty() ? dir.resolve(FIRST_SEGMENT) : segs.get(segs.size() - 1);
        ch = FileChannel.open(current, CREATE, WRITE, READ);
        writtenInSegment = ch.size();
        ch.position(writtenInSegment);
    }

    private static List<Path> segments(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /** Sequential reader over all segments used during recovery. */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segment = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() throws IOException {
            while (!stopped) {
                if (ch == null && !openNext()) return null;
                byte[] payload = readRecord();
                if (payload != null) return payload;
                // A clean end of segment moves on; anything torn ends replay.
                if (pos < ch.size()) {
                    log.info("WAL replay stopped at torn record in " + segments.get(segment) + " offset " + pos);
                    stopped = true;
                    return null;
                }
                ch.close();
                ch = null;
            }
            return null;
        }

        private boolean openNext() throws IOException {
            if (segment + 1 >= segments.size()) return false;
            segment++;
            ch = FileChannel.open(segments.get(segment), READ);
            pos = 0;
            return true;
        }

        private byte[] readRecord() throws IOException {
            ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_LEN).order(ByteOrder.LITTLE_ENDIAN);
            int read = ch.read(hdr, pos);
            if (read < RecordCodec.HEADER_LEN) return null; // EOF or truncated header
            hdr.flip();
            short magic = hdr.getShort();
            byte ver = hdr.get();
            int len = hdr.getInt();
            int crc = hdr.getInt();
            if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
            if (pos + RecordCodec.HEADER_LEN + len > ch.size()) return null; // truncated payload
            ByteBuffer payload = ByteBuffer.allocate(len);
            while (payload.hasRemaining()) {
                if (ch.read(payload, pos + RecordCodec.HEADER_LEN + payload.position()) <= 0) return null;
            }
            byte[] bytes = payload.array();
            if (RecordCodec.crc32(bytes) != crc) return null;
            pos += RecordCodec.HEADER_LEN + len;
            return bytes;
        }

        @Override
        public boolean stoppedAtTear() {
            return stopped;
        }

        @Override
        public void close() throws IOException {
            if (ch != null) ch.close();
        }
    }
}
