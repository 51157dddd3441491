package com.agentledger.domain.model;

import com.agentledger.domain.enums.PositionSide;
import com.agentledger.domain.enums.TradeSource;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * A closed round trip produced by one of the matcher passes.
 *
 * <p>{@code holdingDuration} is the display form ({@code 1h 30m}, {@code 45m}) or
 * {@code -} when the opening event is unknown. Pairings with a negative holding
 * time are never emitted.
 */
@Data
@Builder
public class CompletedTrade {

    private String id;
    private String asset;
    private PositionSide direction;
    private BigDecimal entryPrice;
    private BigDecimal exitPrice;
    private BigDecimal quantity;
    private BigDecimal entryNotional;
    private BigDecimal exitNotional;
    private String holdingDuration;
    private BigDecimal realizedPnl;
    private Instant openedAt;
    private Instant closedAt;
    private String sourceHash;
    private TradeSource source;
}
