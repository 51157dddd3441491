package com.agentledger.stats;

import com.agentledger.config.AgentLedgerProperties;
import com.agentledger.domain.model.AgentStats;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the last stats published per account so a poll without a live P&L figure
 * repeats the previous value rather than regressing it.
 */
@Component
public class StatsPublisher {

    private static final Logger log = LoggerFactory.getLogger(StatsPublisher.class);

    private final Cache<String, AgentStats> lastPublished;

    public StatsPublisher(AgentLedgerProperties properties) {
        this.lastPublished =
                Caffeine.newBuilder().maximumSize(properties.getStatsCacheSize()).build();
    }

    /**
     * Publishes {@code update} when present, otherwise returns the previous stats for
     * the account (null if none were ever published).
     */
    public AgentStats publish(String accountKey, Optional<AgentStats> update) {
        if (update.isPresent()) {
            lastPublished.put(accountKey, update.get());
            return update.get();
        }
        AgentStats previous = lastPublished.getIfPresent(accountKey);
        log.debug("No stats update for {}, reusing previous ({})", accountKey, previous != null ? "present" : "none");
        return previous;
    }
}
