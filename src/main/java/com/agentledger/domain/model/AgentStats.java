package com.agentledger.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Aggregate performance over the published completed-trade set.
 *
 * <p>{@code totalPnl} is the exchange's total return (account value minus net
 * deposits), not a sum of trade P&L, so funding and fees are included.
 */
@Data
@Builder
public class AgentStats {

    private int totalTrades;
    private BigDecimal winRate;
    private BigDecimal totalPnl;

    /** Rendered as {@code Dd Hh Mm}, or {@code -} with no trades. */
    private String avgHoldingDuration;

    private int holdDecisions;
    private int longCount;
    private int shortCount;
    private BigDecimal longVolume;
    private BigDecimal shortVolume;
}
