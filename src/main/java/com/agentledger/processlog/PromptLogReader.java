package com.agentledger.processlog;

import com.agentledger.config.AgentLedgerProperties;
import com.agentledger.domain.model.MarketSnapshot;
import com.agentledger.io.ArtifactLineReader;
import com.agentledger.io.ArtifactLocator;
import com.agentledger.io.TimestampParser;
import com.agentledger.mapper.JsonHelper;
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
 * Reads the latest market/account snapshot from the agent's prompt log.
 *
 * <p>The agent appends one block per decision cycle: a
 * {@code --- 2024-01-01 12:00:00.123456 - ALL ASSETS ---} header followed by the
 * pretty-printed JSON prompt context. Blocks whose body does not parse (including a
 * block still being written) are skipped in favour of the previous one.
 */
@Service
public class PromptLogReader {

    private static final Logger log = LoggerFactory.getLogger(PromptLogReader.class);

    private static final Pattern HEADER = Pattern.compile(
            "^---\\s*(\\d{4}-\\d{2}-\\d{2}\\s+\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?)\\s*-\\s*ALL ASSETS\\s*---\\s*$");

    private final ArtifactLocator artifactLocator;
    private final ArtifactLineReader artifactLineReader;
    private final ZoneId zone;

    public PromptLogReader(
            ArtifactLocator artifactLocator, ArtifactLineReader artifactLineReader, AgentLedgerProperties properties) {
        this.artifactLocator = artifactLocator;
        this.artifactLineReader = artifactLineReader;
        this.zone = properties.zone();
    }

    public Optional<MarketSnapshot> readLatest(String accountKey) {
        Optional<Path> promptLog = artifactLocator.promptLogFor(accountKey);
        if (promptLog.isEmpty()) {
            return Optional.empty();
        }
        try {
            return latestSnapshot(artifactLineReader.readCompleteLines(promptLog.get()));
        } catch (IOException e) {
            log.warn("Failed to read prompt log {}: {}", promptLog.get(), e.getMessage());
            return Optional.empty();
        }
    }

    Optional<MarketSnapshot> latestSnapshot(List<String> lines) {
        List<Block> blocks = new ArrayList<>();
        Block current = null;
        for (String line : lines) {
            Matcher header = HEADER.matcher(line.trim());
            if (header.matches()) {
                current = new Block(header.group(1), new StringBuilder());
                blocks.add(current);
            } else if (current != null) {
                current.body().append(line).append('\n');
            }
        }

        for (int i = blocks.size() - 1; i >= 0; i--) {
            Optional<MarketSnapshot> snapshot = toSnapshot(blocks.get(i));
            if (snapshot.isPresent()) {
                return snapshot;
            }
        }
        return Optional.empty();
    }

    private Optional<MarketSnapshot> toSnapshot(Block block) {
        Optional<Instant> timestamp = TimestampParser.parse(block.header(), zone);
        if (timestamp.isEmpty()) {
            return Optional.empty();
        }
        Optional<MarketSnapshot> snapshot = JsonHelper.tryParse(block.body().toString(), MarketSnapshot.class);
        snapshot.ifPresent(s -> s.setTimestamp(timestamp.get()));
        if (snapshot.isEmpty()) {
            log.debug("Skipping unparseable prompt log block at {}", block.header());
        }
        return snapshot;
    }

    private record Block(String header, StringBuilder body) {}
}
