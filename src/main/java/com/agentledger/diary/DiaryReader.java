package com.agentledger.diary;

import com.agentledger.config.AgentLedgerProperties;
import com.agentledger.domain.enums.DiaryAction;
import com.agentledger.domain.model.DiaryRecord;
import com.agentledger.io.ArtifactLineReader;
import com.agentledger.io.ArtifactLocator;
import com.agentledger.io.TimestampParser;
import com.agentledger.mapper.JsonHelper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reads an account's decision diary: one JSON object per line, appended by the agent
 * once per decision.
 *
 * <p>Each line is parsed on its own. A line that is not valid JSON, lacks a timestamp,
 * asset or action, or names an unknown action is skipped and counted; the rest of the
 * file is still read. A missing diary is an empty diary.
 *
 * <p>{@code agentledger.diary.malformed.lines} counts each bad line once: lines below
 * the number already examined for that file are not counted again on later polls.
 */
@Service
public class DiaryReader {

    private static final Logger log = LoggerFactory.getLogger(DiaryReader.class);

    private final ArtifactLocator artifactLocator;
    private final ArtifactLineReader artifactLineReader;
    private final ZoneId zone;
    private final Counter malformedLinesCounter;
    private final Cache<Path, Integer> examinedLines;

    public DiaryReader(
            ArtifactLocator artifactLocator,
            ArtifactLineReader artifactLineReader,
            AgentLedgerProperties properties,
            MeterRegistry meterRegistry) {
        this.artifactLocator = artifactLocator;
        this.artifactLineReader = artifactLineReader;
        this.zone = properties.zone();
        this.malformedLinesCounter = Counter.builder("agentledger.diary.malformed.lines")
                .description("Diary lines skipped because they were not valid records")
                .register(meterRegistry);
        this.examinedLines =
                Caffeine.newBuilder().maximumSize(properties.getCursorCacheSize()).build();
    }

    /**
     * Returns the account's diary records in file order.
     *
     * @param accountKey opaque account identifier; selects {@code <accountKey>.jsonl}
     *                   with the shared diary as fallback
     * @param limit      keep only the newest {@code limit} records; 0 or less keeps all
     */
    public DiaryReadResult read(String accountKey, int limit) {
        Optional<Path> diaryPath = artifactLocator.diaryFor(accountKey);
        if (diaryPath.isEmpty()) {
            log.debug("No diary found for account {}", accountKey);
            return DiaryReadResult.empty();
        }

        List<String> lines;
        try {
            lines = artifactLineReader.readCompleteLines(diaryPath.get());
        } catch (IOException e) {
            log.warn("Failed to read diary {}: {}", diaryPath.get(), e.getMessage());
            return DiaryReadResult.empty();
        }

        List<DiaryRecord> records = new ArrayList<>();
        List<Integer> malformed = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            Optional<DiaryRecord> diaryRecord = parseLine(line, i);
            if (diaryRecord.isPresent()) {
                records.add(diaryRecord.get());
            } else {
                malformed.add(i);
                log.debug("Skipping malformed diary line {} in {}", i + 1, diaryPath.get());
            }
        }

        int newlyMalformed = countNewlyMalformed(diaryPath.get(), lines.size(), malformed);
        if (newlyMalformed > 0) {
            malformedLinesCounter.increment(newlyMalformed);
        }

        if (limit > 0 && records.size() > limit) {
            records = records.subList(records.size() - limit, records.size());
        }

        return DiaryReadResult.builder()
                .records(List.copyOf(records))
                .skippedLines(malformed.size())
                .build();
    }

    /** A shorter line list than last time means the diary was rewritten; count it afresh. */
    private int countNewlyMalformed(Path path, int lineCount, List<Integer> malformed) {
        int[] fresh = new int[1];
        examinedLines.asMap().compute(path.toAbsolutePath().normalize(), (p, examined) -> {
            int from = examined == null || examined > lineCount ? 0 : examined;
            fresh[0] = (int) malformed.stream().filter(i -> i >= from).count();
            return lineCount;
        });
        return fresh[0];
    }

    Optional<DiaryRecord> parseLine(String line, long sequence) {
        Optional<RawDiaryLine> parsed = JsonHelper.tryParse(line, RawDiaryLine.class);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        RawDiaryLine raw = parsed.get();
        if (raw.getAsset() == null || raw.getAsset().isBlank()) {
            return Optional.empty();
        }
        Optional<Instant> timestamp = TimestampParser.parse(raw.getTimestamp(), zone);
        Optional<DiaryAction> action = DiaryAction.fromWire(raw.getAction());
        if (timestamp.isEmpty() || action.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(DiaryRecord.builder()
                .sequence(sequence)
                .timestamp(timestamp.get())
                .asset(raw.getAsset().trim())
                .action(action.get())
                .rationale(raw.getRationale())
                .allocationUsd(raw.getAllocationUsd())
                .amount(raw.getAmount())
                .entryPrice(raw.getEntryPrice())
                .takeProfitPrice(raw.getTakeProfitPrice())
                .stopLossPrice(raw.getStopLossPrice())
                .exitPlan(raw.getExitPlan())
                .orderResult(orderResultText(raw))
                .reason(raw.getReason())
                .openedAt(raw.getOpenedAt())
                .filled(raw.getFilled())
                .build());
    }

    private String orderResultText(RawDiaryLine raw) {
        if (raw.getOrderResult() == null || raw.getOrderResult().isNull()) {
            return null;
        }
        return raw.getOrderResult().isTextual()
                ? raw.getOrderResult().asText()
                : raw.getOrderResult().toString();
    }
}
