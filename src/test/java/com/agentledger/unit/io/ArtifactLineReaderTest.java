package com.agentledger.unit.io;

import static org.assertj.core.api.Assertions.assertThat;

import com.agentledger.config.AgentLedgerProperties;
import com.agentledger.io.ArtifactLineReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArtifactLineReaderTest {

    @TempDir
    Path tempDir;

    private ArtifactLineReader artifactLineReader;
    private Path file;

    @BeforeEach
    void setUp() {
        artifactLineReader = new ArtifactLineReader(new AgentLedgerProperties());
        file = tempDir.resolve("diary.jsonl");
    }

    private void write(String content) throws Exception {
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private void append(String content) throws Exception {
        Files.writeString(file, content, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
    }

    @Nested
    @DisplayName("Complete lines")
    class CompleteLines {

        @Test
        @DisplayName("Trailing partial line is held back until its newline arrives")
        void partialLineHeldBack() throws Exception {
            write("first\nsecond\npart");

            assertThat(artifactLineReader.readCompleteLines(file)).containsExactly("first", "second");

            append("ial\n");

            assertThat(artifactLineReader.readCompleteLines(file)).containsExactly("first", "second", "partial");
        }

        @Test
        @DisplayName("CRLF terminators are stripped")
        void crlfStripped() throws Exception {
            write("one\r\ntwo\r\n");

            assertThat(artifactLineReader.readCompleteLines(file)).containsExactly("one", "two");
        }

        @Test
        @DisplayName("Missing file yields no lines")
        void missingFile() throws Exception {
            assertThat(artifactLineReader.readCompleteLines(tempDir.resolve("absent.jsonl")))
                    .isEmpty();
        }

        @Test
        @DisplayName("Reading an unchanged file twice returns identical lines")
        void unchangedFileIsStable() throws Exception {
            write("a\nb\n");

            List<String> first = artifactLineReader.readCompleteLines(file);
            List<String> second = artifactLineReader.readCompleteLines(file);

            assertThat(second).isEqualTo(first).containsExactly("a", "b");
        }

        @Test
        @DisplayName("Appended lines are added after those already read")
        void appendedLinesFollow() throws Exception {
            write("a\n");
            artifactLineReader.readCompleteLines(file);

            append("b\nc\n");

            assertThat(artifactLineReader.readCompleteLines(file)).containsExactly("a", "b", "c");
        }
    }

    @Nested
    @DisplayName("Chunked reads")
    class ChunkedReads {

        private ArtifactLineReader smallChunkReader;

        @BeforeEach
        void setUp() {
            AgentLedgerProperties properties = new AgentLedgerProperties();
            properties.setReadChunkBytes(4);
            smallChunkReader = new ArtifactLineReader(properties);
        }

        @Test
        @DisplayName("Lines longer than a chunk are assembled across chunks")
        void linesSpanChunks() throws Exception {
            write("alpha\nbe\ngamma-delta-epsilon\npart");

            assertThat(smallChunkReader.readCompleteLines(file))
                    .containsExactly("alpha", "be", "gamma-delta-epsilon");

            append("ial\r\n");

            assertThat(smallChunkReader.readCompleteLines(file))
                    .containsExactly("alpha", "be", "gamma-delta-epsilon", "partial");
        }

        @Test
        @DisplayName("Multi-byte characters split by a chunk boundary decode intact")
        void multiByteAcrossBoundary() throws Exception {
            write("h\u00e9llo \u20ac\n\u00fcber\n");

            assertThat(smallChunkReader.readCompleteLines(file)).containsExactly("h\u00e9llo \u20ac", "\u00fcber");
        }

        @Test
        @DisplayName("A large append matches what a single-chunk read returns")
        void largeAppend() throws Exception {
            StringBuilder content = new StringBuilder();
            for (int i = 0; i < 500; i++) {
                content.append("{\"seq\": ").append(i).append("}\n");
            }
            write(content.toString());

            assertThat(smallChunkReader.readCompleteLines(file))
                    .hasSize(500)
                    .isEqualTo(artifactLineReader.readCompleteLines(file));
        }
    }

    @Nested
    @DisplayName("Rotation and rewrite")
    class Rotation {

        @Test
        @DisplayName("A truncated file is re-read from the start")
        void truncatedFileResets() throws Exception {
            write("a\nb\nc\n");
            artifactLineReader.readCompleteLines(file);

            write("x\n");

            assertThat(artifactLineReader.readCompleteLines(file)).containsExactly("x");
        }

        @Test
        @DisplayName("A rewritten file of the same length is re-read from the start")
        void rewrittenPrefixResets() throws Exception {
            write("aaaa\n");
            artifactLineReader.readCompleteLines(file);

            write("bbbb\n");

            assertThat(artifactLineReader.readCompleteLines(file)).containsExactly("bbbb");
        }

        @Test
        @DisplayName("A deleted file yields no lines")
        void deletedFile() throws Exception {
            write("a\n");
            artifactLineReader.readCompleteLines(file);

            Files.delete(file);

            assertThat(artifactLineReader.readCompleteLines(file)).isEmpty();
        }
    }
}
