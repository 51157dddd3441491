package com.agentledger.exchange.dto;

import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Raw payloads fetched for one account in one poll. The state is always present;
 * a null list means that part could not be fetched.
 */
@Data
@Builder
public class RawExchangeSnapshot {

    private RawClearinghouseState state;
    private List<RawFill> fills;
    private List<RawOpenOrder> openOrders;
    private List<RawLedgerUpdate> ledgerUpdates;
}
