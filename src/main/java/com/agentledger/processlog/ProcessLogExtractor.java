package com.agentledger.processlog;

import com.agentledger.config.AgentLedgerProperties;
import com.agentledger.domain.model.DecisionRationale;
import com.agentledger.domain.model.ProcessLogExtract;
import com.agentledger.domain.model.ReasoningEntry;
import com.agentledger.io.ArtifactLineReader;
import com.agentledger.io.ArtifactLocator;
import com.agentledger.io.TimestampParser;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pulls the agent's reasoning out of its free-text process log.
 *
 * <p>Two line shapes start a new log entry:
 * <ul>
 *   <li>Python logging: {@code 2024-01-01 12:00:00,123 - INFO - message}</li>
 *   <li>Bracketed ISO: {@code [2024-01-01T12:00:00.123Z] message}</li>
 * </ul>
 *
 * <p>A {@value #REASONING_MARKER} entry owns every following line up to the next
 * entry or end of file, so multi-line summaries are kept whole. A
 * {@code Decision rationale for <ASSET>:} entry is one line. Everything else is
 * ignored.
 */
@Service
public class ProcessLogExtractor {

    private static final Logger log = LoggerFactory.getLogger(ProcessLogExtractor.class);

    static final String REASONING_MARKER = "LLM reasoning summary:";

    private static final Pattern PYTHON_ENTRY = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2}[ T]\\d{2}:\\d{2}:\\d{2}(?:[,.]\\d+)?)\\s*-\\s*[A-Z]+\\s*-\\s?(.*)$");

    private static final Pattern BRACKETED_ENTRY = Pattern.compile("^\\[(\\d{4}-\\d{2}-\\d{2}[ T][^\\]]+)]\\s?(.*)$");

    private static final Pattern RATIONALE = Pattern.compile("^Decision rationale for (\\w+):\\s*(.+)$");

    private final ArtifactLocator artifactLocator;
    private final ArtifactLineReader artifactLineReader;
    private final ZoneId zone;

    public ProcessLogExtractor(
            ArtifactLocator artifactLocator, ArtifactLineReader artifactLineReader, AgentLedgerProperties properties) {
        this.artifactLocator = artifactLocator;
        this.artifactLineReader = artifactLineReader;
        this.zone = properties.zone();
    }

    public ProcessLogExtract extract(String accountKey) {
        Optional<Path> logPath = artifactLocator.processLogFor(accountKey);
        if (logPath.isEmpty()) {
            return ProcessLogExtract.empty();
        }
        try {
            return extract(artifactLineReader.readCompleteLines(logPath.get()));
        } catch (IOException e) {
            log.warn("Failed to read process log {}: {}", logPath.get(), e.getMessage());
            return ProcessLogExtract.empty();
        }
    }

    ProcessLogExtract extract(List<String> lines) {
        List<ReasoningEntry> reasonings = new ArrayList<>();
        List<DecisionRationale> rationales = new ArrayList<>();

        Instant blockTimestamp = null;
        StringBuilder block = null;

        for (String line : lines) {
            Optional<LogEntry> entry = parseEntry(line);
            if (entry.isEmpty()) {
                if (block != null) {
                    block.append('\n').append(line);
                }
                continue;
            }

            if (block != null) {
                addReasoning(reasonings, blockTimestamp, block);
                block = null;
            }

            String message = entry.get().message();
            if (message.startsWith(REASONING_MARKER)) {
                blockTimestamp = entry.get().timestamp();
                block = new StringBuilder(message.substring(REASONING_MARKER.length()));
                continue;
            }

            Matcher rationale = RATIONALE.matcher(message);
            if (rationale.matches()) {
                rationales.add(DecisionRationale.builder()
                        .timestamp(entry.get().timestamp())
                        .asset(rationale.group(1))
                        .text(rationale.group(2).trim())
                        .build());
            }
        }
        if (block != null) {
            addReasoning(reasonings, blockTimestamp, block);
        }

        log.debug("Extracted {} reasoning blocks and {} rationales", reasonings.size(), rationales.size());
        return ProcessLogExtract.builder()
                .reasonings(List.copyOf(reasonings))
                .rationales(List.copyOf(rationales))
                .build();
    }

    private void addReasoning(List<ReasoningEntry> reasonings, Instant timestamp, StringBuilder block) {
        String text = block.toString().trim();
        if (!text.isEmpty()) {
            reasonings.add(ReasoningEntry.builder().timestamp(timestamp).text(text).build());
        }
    }

    private Optional<LogEntry> parseEntry(String line) {
        Matcher matcher = PYTHON_ENTRY.matcher(line);
        if (!matcher.matches()) {
            matcher = BRACKETED_ENTRY.matcher(line);
            if (!matcher.matches()) {
                return Optional.empty();
            }
        }
        Optional<Instant> timestamp = TimestampParser.parse(matcher.group(1), zone);
        if (timestamp.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new LogEntry(timestamp.get(), matcher.group(2).trim()));
    }

    private record LogEntry(Instant timestamp, String message) {}
}
