package com.agentledger.domain.model;

import com.agentledger.domain.enums.DataSource;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AccountState {

    /** Total account value including unrealized P&L. */
    private BigDecimal balance;

    private BigDecimal unrealizedPnl;
    private BigDecimal marginUsed;
    private DataSource source;
}
