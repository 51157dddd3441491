package com.agentledger.domain.enums;

/**
 * Which matching pass produced a completed trade.
 *
 * <p>EXCHANGE_FILL results supersede both diary passes whenever the fill window is
 * non-empty. NONE is reported when no pass produced anything.
 */
public enum TradeSource {
    DIARY_CORRELATION,
    DIARY_SEQUENCE,
    EXCHANGE_FILL,
    NONE
}
