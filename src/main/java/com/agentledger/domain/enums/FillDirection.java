package com.agentledger.domain.enums;

import java.util.Optional;

/**
 * Direction of an exchange fill as reported in the fill's {@code dir} text.
 *
 * <p>Position flips ({@code Long > Short}, {@code Short > Long}) close the old side;
 * they are classified by the side being closed.
 */
public enum FillDirection {
    OPEN_LONG,
    OPEN_SHORT,
    CLOSE_LONG,
    CLOSE_SHORT;

    public boolean isOpening() {
        return this == OPEN_LONG || this == OPEN_SHORT;
    }

    public boolean isClosing() {
        return this == CLOSE_LONG || this == CLOSE_SHORT;
    }

    /** Side of the position this fill opens or closes. */
    public PositionSide side() {
        return this == OPEN_LONG || this == CLOSE_LONG ? PositionSide.LONG : PositionSide.SHORT;
    }

    public static Optional<FillDirection> fromExchangeDir(String dir) {
        if (dir == null) {
            return Optional.empty();
        }
        return switch (dir.trim()) {
            case "Open Long" -> Optional.of(OPEN_LONG);
            case "Open Short" -> Optional.of(OPEN_SHORT);
            case "Close Long", "Long > Short" -> Optional.of(CLOSE_LONG);
            case "Close Short", "Short > Long" -> Optional.of(CLOSE_SHORT);
            default -> Optional.empty();
        };
    }
}
