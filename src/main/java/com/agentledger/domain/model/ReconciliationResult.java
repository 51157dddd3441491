package com.agentledger.domain.model;

import com.agentledger.domain.enums.TradeSource;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Everything one poll reconciled for an account.
 *
 * <p>{@code stats} is null until live P&L has been available at least once for the
 * account. {@code accountState} is null when neither the exchange nor the prompt log
 * reported an account value.
 */
@Data
@Builder
public class ReconciliationResult {

    private String accountKey;

    @Builder.Default
    private List<Position> positions = List.of();

    @Builder.Default
    private List<CompletedTrade> completedTrades = List.of();

    @Builder.Default
    private List<Order> openOrders = List.of();

    private AgentStats stats;
    private AccountState accountState;

    @Builder.Default
    private List<FeedEntry> feed = List.of();

    private TradeSource tradeSource;
    private boolean exchangeAvailable;
    private int skippedDiaryLines;
    private Instant reconciledAt;
    private long durationMs;
}
