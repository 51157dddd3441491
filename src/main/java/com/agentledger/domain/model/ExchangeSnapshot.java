package com.agentledger.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Normalized live exchange view for one account.
 *
 * <p>When {@link #available} is false every other field is empty and callers must
 * fall back to the agent's own artifacts. {@link #totalRealizedPnl} is null when the
 * ledger could not be fetched; it is never approximated from trade P&L.
 */
@Data
@Builder
public class ExchangeSnapshot {

    private boolean available;
    private AccountState accountState;

    @Builder.Default
    private List<Position> positions = List.of();

    @Builder.Default
    private List<Fill> fills = List.of();

    @Builder.Default
    private List<Order> openOrders = List.of();

    /** Account value minus net deposits. */
    private BigDecimal totalRealizedPnl;

    public static ExchangeSnapshot unavailable() {
        return ExchangeSnapshot.builder().available(false).build();
    }
}
