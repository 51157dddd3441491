package com.agentledger.io;

import com.agentledger.config.AgentLedgerProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the complete lines of an artifact the agent may still be appending to.
 *
 * <p>Only newline-terminated lines are returned. A trailing partial line is left on
 * disk and picked up by the next read once the agent finishes writing it.
 *
 * <p>A per-file cursor (byte offset of the last complete line plus the lines read so
 * far) is kept in a Caffeine cache, so a poll only reads bytes appended since the
 * previous poll. The cursor only moves forward. It is discarded, and the file re-read
 * from the start, when the file is shorter than the cursor or its already-consumed
 * prefix has changed (rotation or rewrite). Updates are atomic per file via
 * {@code asMap().compute}; different files never contend.
 *
 * <p>Appended bytes are read in chunks of at most {@code agentledger.read-chunk-bytes},
 * so a large append never needs a single buffer of its full size.
 */
@Component
public class ArtifactLineReader {

    private static final Logger log = LoggerFactory.getLogger(ArtifactLineReader.class);

    /** Bytes of already-consumed prefix compared to detect a rewritten file. */
    static final int FINGERPRINT_BYTES = 64;

    private final Cache<Path, Cursor> cursors;
    private final int chunkBytes;

    public ArtifactLineReader(AgentLedgerProperties properties) {
        this.cursors =
                Caffeine.newBuilder().maximumSize(properties.getCursorCacheSize()).build();
        this.chunkBytes = Math.max(1, properties.getReadChunkBytes());
    }

    /**
     * Returns every complete line of {@code path}, oldest first. Lines keep their text
     * without the terminator ({@code \r\n} and {@code \n} both accepted). A missing file
     * yields an empty list.
     *
     * @throws IOException if the file exists but cannot be read
     */
    public List<String> readCompleteLines(Path path) throws IOException {
        Path key = path.toAbsolutePath().normalize();
        try {
            Cursor cursor = cursors.asMap().compute(key, (p, previous) -> advance(p, previous));
            return cursor == null ? List.of() : cursor.lines();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private Cursor advance(Path path, Cursor previous) {
        try {
            if (!Files.isRegularFile(path)) {
                return null;
            }
            long size = Files.size(path);
            try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
                Cursor start = previous;
                if (start != null && (size < start.offset() || !prefixUnchanged(channel, start))) {
                    log.info("Artifact {} was truncated or rewritten, re-reading from start", path);
                    start = null;
                }
                if (start == null) {
                    start = Cursor.EMPTY;
                }
                if (size == start.offset()) {
                    return start;
                }
                return readFrom(channel, start, size);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Cursor readFrom(FileChannel channel, Cursor start, long size) throws IOException {
        List<String> lines = new ArrayList<>(start.lines());
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        long position = start.offset();
        long consumed = start.offset();

        while (position < size) {
            byte[] chunk = readBytes(channel, position, (int) Math.min(chunkBytes, size - position));
            if (chunk.length == 0) {
                break;
            }
            int lineStart = 0;
            for (int i = 0; i < chunk.length; i++) {
                if (chunk[i] == '\n') {
                    pending.write(chunk, lineStart, i - lineStart);
                    lines.add(decodeLine(pending.toByteArray()));
                    pending.reset();
                    lineStart = i + 1;
                    consumed = position + i + 1;
                }
            }
            pending.write(chunk, lineStart, chunk.length - lineStart);
            position += chunk.length;
        }

        if (consumed == start.offset()) {
            return start;
        }
        byte[] prefix = start.prefix().length >= FINGERPRINT_BYTES
                ? start.prefix()
                : readBytes(channel, 0, (int) Math.min(FINGERPRINT_BYTES, consumed));
        return new Cursor(consumed, prefix, List.copyOf(lines));
    }

    private static String decodeLine(byte[] bytes) {
        String line = new String(bytes, StandardCharsets.UTF_8);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private boolean prefixUnchanged(FileChannel channel, Cursor cursor) throws IOException {
        byte[] current = readBytes(channel, 0, cursor.prefix().length);
        return Arrays.equals(current, cursor.prefix());
    }

    private static byte[] readBytes(FileChannel channel, long position, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        long offset = position;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, offset);
            if (read < 0) {
                break;
            }
            offset += read;
        }
        return Arrays.copyOf(buffer.array(), buffer.position());
    }

    private record Cursor(long offset, byte[] prefix, List<String> lines) {

        static final Cursor EMPTY = new Cursor(0, new byte[0], List.of());
    }
}
