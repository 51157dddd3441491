package com.agentledger.domain.model;

import com.agentledger.domain.enums.DataSource;
import com.agentledger.domain.enums.PositionSide;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current open exposure for one asset.
 *
 * <p>Quantity is always a positive magnitude; direction lives in {@link #side}.
 * Positions come from the live exchange snapshot. PROMPT_LOG and DIARY positions
 * are fallbacks used only while the exchange is unavailable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;
    private String asset;
    private PositionSide side;
    private BigDecimal entryPrice;

    /** Mark price: position value / |size| for exchange positions. */
    private BigDecimal currentPrice;

    private BigDecimal quantity;
    private int leverage;
    private BigDecimal unrealizedPnl;
    private BigDecimal liquidationPrice;
    private DataSource source;
}
