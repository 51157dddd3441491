package com.agentledger.domain.enums;

/**
 * Direction of a position or completed trade.
 * Positive signed size = LONG, negative = SHORT.
 */
public enum PositionSide {
    LONG,
    SHORT
}
