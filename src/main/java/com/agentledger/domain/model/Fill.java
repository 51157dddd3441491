package com.agentledger.domain.model;

import com.agentledger.domain.enums.FillDirection;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * One exchange-reported execution. {@code notional} is always recomputed as
 * price x quantity by the normalizer, never copied from the exchange payload.
 */
@Data
@Builder
public class Fill {

    private String id;
    private String asset;
    private FillDirection direction;
    private BigDecimal price;
    private BigDecimal quantity;
    private BigDecimal notional;
    private BigDecimal feeUsd;

    /** Exchange-computed realized P&L (net of fees). Zero for opening fills. */
    private BigDecimal realizedPnl;

    private long timestampMs;
    private String transactionHash;

    public Instant getTimestamp() {
        return Instant.ofEpochMilli(timestampMs);
    }
}
