// file: storage/src/main/java/io/rangelite/storage/FileWal.java
package io.rangelite.storage;

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
 * File-backed WAL that appends header+payload records to segment files
 * ("00000001.log", "00000002.log", ...).
 * <p>
 *  - On construction it creates the directory if needed and opens the newest
 *    segment for append, truncating a torn record left at its tail.
 *  - append() writes the bytes and calls force(true).
 *  - rotateIfNeeded() starts a new segment once the current one holds at
 *    least rotateBytes.
 *  - The reader walks every segment in order. A torn record ends the segment
 *    it is in; since only the newest segment is ever appended to, that is
 *    also the end of the log.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());
    private static final int HEADER_BYTES = 11;

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) {
            throw new IllegalArgumentException("rotateBytes must be > 0");
        }
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new RuntimeException(e); }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new RuntimeException("WAL append failed: " + current, e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            current = dir.resolve(segmentName(segmentIndex(current) + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) { throw new RuntimeException("WAL rotation failed", e); }
    }

    @Override
    public WalReader openReader() { return new Reader(segments(dir)); }

    @Override
    public synchronized void close() throws IOException { if (ch != null) ch.close(); }

    /**
     * Open the newest segment for append, cutting off a torn record at its
     * tail so that later appends stay readable.
     */
    private void openNewestOrCreate() {
        try {
            List<Path> segs = segments(dir);
            current = segs.isEmpty() ? dir.resolve(segmentName(1)) : segs.get(segs.size() - 1);
            long valid = segs.isEmpty() ? 0 : validPrefix(current);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            if (ch.size() > valid) {
                log.warning("truncating " + (ch.size() - valid) + " bytes of torn WAL tail in " + current);
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(writtenInSegment);
        } catch (IOException e) { throw new RuntimeException(e); }
    }

    private static long validPrefix(Path seg) throws IOException {
        Reader r = new Reader(List.of(seg));
        try {
            while (r.next() != null) {
                // only the end offset matters
            }
            return r.pos;
        } finally {
            r.close();
        }
    }

    static String segmentName(int index) {
        return String.format("%08d.log", index);
    }

    private static int segmentIndex(Path seg) {
        return Integer.parseInt(seg.getFileName().toString().replace(".log", ""));
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new RuntimeException("listing WAL segments failed: " + dir, e);
        }
    }

    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segIdx = -1;
        private FileChannel ch;
        private long pos = 0;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            try {
                while (true) {
                    if (ch == null && !openNextSegment()) return null;
                    byte[] rec = readRecord();
                    if (rec != null) return rec;
                    ch.close();
                    ch = null;
                }
            } catch (IOException e) {
                throw new RuntimeException(e);
            }
        }

        private boolean openNextSegment() throws IOException {
            segIdx++;
            if (segIdx >= segments.size()) return false;
            ch = FileChannel.open(segments.get(segIdx), READ);
            pos = 0;
            return true;
        }

        private byte[] readRecord() throws IOException {
            ByteBuffer hdr = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
            int read = ch.read(hdr, pos);
            if (read < HEADER_BYTES) return null; // EOF or truncated header
            hdr.flip();
            short magic = hdr.getShort();
            byte ver = hdr.get();
            int len = hdr.getInt();
            int crc = hdr.getInt();
            if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
            if (pos + HEADER_BYTES + len > ch.size()) return null; // truncated payload
            ByteBuffer payload = ByteBuffer.allocate(len);
            while (payload.hasRemaining()) {
                if (ch.read(payload, pos + HEADER_BYTES + payload.position()) < 0) return null;
            }
            byte[] bytes = payload.array();
            if (RecordCodec.crc32(bytes) != crc) return null; // bad tail
            pos += HEADER_BYTES + len;
            return bytes;
        }

        @Override
        public void close() throws IOException {
            if (ch != null) ch.close();
        }
    }
}
