package com.agentledger.domain.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * One agent decision per diary line.
 *
 * <p>The agent writes entries as {@code buy}/{@code sell}; the hyphenated and
 * underscored names are accepted too so older diaries keep parsing.
 */
public enum DiaryAction {
    HOLD,
    OPEN_LONG,
    OPEN_SHORT,
    RECONCILE_CLOSE;

    public boolean isOpen() {
        return this == OPEN_LONG || this == OPEN_SHORT;
    }

    public static Optional<DiaryAction> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "hold" -> Optional.of(HOLD);
            case "buy", "open_long" -> Optional.of(OPEN_LONG);
            case "sell", "open_short" -> Optional.of(OPEN_SHORT);
            case "reconcile_close" -> Optional.of(RECONCILE_CLOSE);
            default -> Optional.empty();
        };
    }
}
