package com.agentledger.domain.model;

import com.agentledger.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/** A resting order on the exchange (limit, take-profit or stop-loss trigger). */
@Data
@Builder
public class Order {

    private String id;
    private String asset;
    private OrderSide side;
    private BigDecimal quantity;
    private BigDecimal limitPrice;
    private BigDecimal triggerPrice;
    private String orderType;
    private boolean reduceOnly;
    private Instant placedAt;
}
