package com.agentledger.unit.diary;

import static org.assertj.core.api.Assertions.assertThat;

import com.agentledger.config.AgentLedgerProperties;
import com.agentledger.diary.DiaryReadResult;
import com.agentledger.diary.DiaryReader;
import com.agentledger.domain.enums.DiaryAction;
import com.agentledger.domain.model.DiaryRecord;
import com.agentledger.io.ArtifactLineReader;
import com.agentledger.io.ArtifactLocator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DiaryReaderTest {

    private static final String OPEN_BTC = "{\"timestamp\": \"2024-01-01T10:00:00\", \"asset\": \"BTC\", \"action\": \"buy\","
            + " \"allocation_usd\": 500, \"amount\": 0.01, \"entry_price\": 50000, \"tp_price\": 52000,"
            + " \"sl_price\": 49000, \"exit_plan\": \"TP at 52k\", \"rationale\": \"Breakout above EMA20\","
            + " \"order_result\": \"{'status': 'ok', 'response': {'data': {'statuses': [{'filled': {'totalSz': '0.01'}}]}}}\","
            + " \"opened_at\": \"2024-01-01T10:00:00\"}";

    private static final String HOLD_ETH =
            "{\"timestamp\": \"2024-01-01T10:05:00\", \"asset\": \"ETH\", \"action\": \"hold\", \"rationale\": \"Chop\"}";

    @TempDir
    Path tempDir;

    private MeterRegistry meterRegistry;
    private DiaryReader diaryReader;

    @BeforeEach
    void setUp() {
        AgentLedgerProperties properties = new AgentLedgerProperties();
        properties.setDiaryDir(tempDir.toString());
        meterRegistry = new SimpleMeterRegistry();
        diaryReader = new DiaryReader(
                new ArtifactLocator(properties), new ArtifactLineReader(properties), properties, meterRegistry);
    }

    private void writeDiary(String fileName, String... lines) throws Exception {
        Files.writeString(tempDir.resolve(fileName), String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Agent wire fields map onto the record")
        void mapsWireFields() throws Exception {
            writeDiary("diary.jsonl", OPEN_BTC);

            DiaryRecord record = diaryReader.read("0xabc", 0).getRecords().get(0);

            assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2024-01-01T10:00:00Z"));
            assertThat(record.getAsset()).isEqualTo("BTC");
            assertThat(record.getAction()).isEqualTo(DiaryAction.OPEN_LONG);
            assertThat(record.getAllocationUsd()).isEqualByComparingTo("500");
            assertThat(record.getAmount()).isEqualByComparingTo("0.01");
            assertThat(record.getEntryPrice()).isEqualByComparingTo("50000");
            assertThat(record.getTakeProfitPrice()).isEqualByComparingTo("52000");
            assertThat(record.getStopLossPrice()).isEqualByComparingTo("49000");
            assertThat(record.getExitPlan()).isEqualTo("TP at 52k");
            assertThat(record.getOpenedAt()).isEqualTo("2024-01-01T10:00:00");
            assertThat(record.isExecuted()).isTrue();
        }

        @Test
        @DisplayName("sell maps to OPEN_SHORT and reconcile_close keeps its reason")
        void mapsActions() throws Exception {
            writeDiary(
                    "diary.jsonl",
                    "{\"timestamp\": \"2024-01-01T10:00:00\", \"asset\": \"SOL\", \"action\": \"sell\"}",
                    "{\"timestamp\": \"2024-01-01T11:00:00\", \"asset\": \"SOL\", \"action\": \"reconcile_close\","
                            + " \"reason\": \"position closed on exchange\", \"opened_at\": \"x\"}");

            DiaryReadResult result = diaryReader.read("0xabc", 0);

            assertThat(result.getRecords())
                    .extracting(DiaryRecord::getAction)
                    .containsExactly(DiaryAction.OPEN_SHORT, DiaryAction.RECONCILE_CLOSE);
            assertThat(result.getRecords().get(1).getReason()).isEqualTo("position closed on exchange");
        }

        @Test
        @DisplayName("An order result reporting an error is not executed")
        void errorOrderResultNotExecuted() throws Exception {
            writeDiary(
                    "diary.jsonl",
                    "{\"timestamp\": \"2024-01-01T10:00:00\", \"asset\": \"BTC\", \"action\": \"buy\","
                            + " \"order_result\": \"{'statuses': [{'error': 'Insufficient margin'}]}\"}");

            assertThat(diaryReader.read("0xabc", 0).getRecords().get(0).isExecuted())
                    .isFalse();
        }

        @Test
        @DisplayName("An order result written as a JSON object is kept as its JSON text")
        void objectOrderResult() throws Exception {
            writeDiary(
                    "diary.jsonl",
                    "{\"timestamp\": \"2024-01-01T10:00:00\", \"asset\": \"BTC\", \"action\": \"buy\","
                            + " \"order_result\": {\"statuses\": [{\"filled\": {\"totalSz\": \"0.01\"}}]}}");

            DiaryRecord record = diaryReader.read("0xabc", 0).getRecords().get(0);

            assertThat(record.getOrderResult()).contains("\"filled\":");
            assertThat(record.isExecuted()).isTrue();
        }
    }

    @Nested
    @DisplayName("Malformed lines")
    class MalformedLines {

        @Test
        @DisplayName("A non-JSON line between two valid lines is skipped and counted")
        void skipsNonJson() throws Exception {
            writeDiary("diary.jsonl", OPEN_BTC, "not-json", HOLD_ETH);

            DiaryReadResult result = diaryReader.read("0xabc", 0);

            assertThat(result.getRecords()).hasSize(2);
            assertThat(result.getSkippedLines()).isEqualTo(1);
            assertThat(meterRegistry.get("agentledger.diary.malformed.lines").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Re-reading the diary counts only malformed lines not seen before")
        void malformedCountedOnce() throws Exception {
            writeDiary("diary.jsonl", OPEN_BTC, "not-json", HOLD_ETH);
            diaryReader.read("0xabc", 0);

            DiaryReadResult reread = diaryReader.read("0xabc", 0);

            assertThat(reread.getSkippedLines()).isEqualTo(1);
            assertThat(meterRegistry.get("agentledger.diary.malformed.lines").counter().count())
                    .isEqualTo(1.0);

            Files.writeString(
                    tempDir.resolve("diary.jsonl"),
                    "{broken\n" + HOLD_ETH + "\n",
                    StandardCharsets.UTF_8,
                    StandardOpenOption.APPEND);

            DiaryReadResult appended = diaryReader.read("0xabc", 0);

            assertThat(appended.getSkippedLines()).isEqualTo(2);
            assertThat(meterRegistry.get("agentledger.diary.malformed.lines").counter().count())
                    .isEqualTo(2.0);
        }

        @Test
        @DisplayName("Unknown actions and missing required fields are malformed")
        void skipsInvalidRecords() throws Exception {
            writeDiary(
                    "diary.jsonl",
                    "{\"timestamp\": \"2024-01-01T10:00:00\", \"asset\": \"BTC\", \"action\": \"moon\"}",
                    "{\"asset\": \"BTC\", \"action\": \"hold\"}",
                    "{\"timestamp\": \"2024-01-01T10:00:00\", \"action\": \"hold\"}",
                    "{\"timestamp\": \"not a time\", \"asset\": \"BTC\", \"action\": \"hold\"}",
                    HOLD_ETH);

            DiaryReadResult result = diaryReader.read("0xabc", 0);

            assertThat(result.getRecords()).extracting(DiaryRecord::getAsset).containsExactly("ETH");
            assertThat(result.getSkippedLines()).isEqualTo(4);
        }

        @Test
        @DisplayName("Blank lines are ignored without counting as malformed")
        void blankLinesIgnored() throws Exception {
            writeDiary("diary.jsonl", OPEN_BTC, "", "   ", HOLD_ETH);

            DiaryReadResult result = diaryReader.read("0xabc", 0);

            assertThat(result.getRecords()).hasSize(2);
            assertThat(result.getSkippedLines()).isZero();
        }

        @Test
        @DisplayName("A line still being appended is not read yet")
        void partialLineNotRead() throws Exception {
            Files.writeString(tempDir.resolve("diary.jsonl"), OPEN_BTC + "\n{\"timestamp\": \"2024-01-01T1");

            DiaryReadResult result = diaryReader.read("0xabc", 0);

            assertThat(result.getRecords()).hasSize(1);
            assertThat(result.getSkippedLines()).isZero();
        }
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("Missing diary is empty")
        void missingDiary() {
            DiaryReadResult result = diaryReader.read("0xabc", 10);

            assertThat(result.getRecords()).isEmpty();
            assertThat(result.getSkippedLines()).isZero();
        }

        @Test
        @DisplayName("Per-account diary is read instead of the shared one")
        void perAccountDiary() throws Exception {
            writeDiary("diary.jsonl", OPEN_BTC);
            writeDiary("0xabc.jsonl", HOLD_ETH);

            assertThat(diaryReader.read("0xabc", 0).getRecords())
                    .extracting(DiaryRecord::getAsset)
                    .containsExactly("ETH");
            assertThat(diaryReader.read("0xdef", 0).getRecords())
                    .extracting(DiaryRecord::getAsset)
                    .containsExactly("BTC");
        }

        @Test
        @DisplayName("Limit keeps the newest records in file order with stable sequences")
        void limitKeepsNewest() throws Exception {
            writeDiary(
                    "diary.jsonl",
                    "{\"timestamp\": \"2024-01-01T10:00:00\", \"asset\": \"A\", \"action\": \"hold\"}",
                    "{\"timestamp\": \"2024-01-01T10:01:00\", \"asset\": \"B\", \"action\": \"hold\"}",
                    "{\"timestamp\": \"2024-01-01T10:02:00\", \"asset\": \"C\", \"action\": \"hold\"}");

            DiaryReadResult result = diaryReader.read("0xabc", 2);

            assertThat(result.getRecords()).extracting(DiaryRecord::getAsset).containsExactly("B", "C");
            assertThat(result.getRecords()).extracting(DiaryRecord::getSequence).containsExactly(1L, 2L);
        }
    }
}
