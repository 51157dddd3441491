package com.agentledger.matching;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders and parses the holding-duration display strings on completed trades.
 *
 * <p>Trades carry {@code 1h 30m} or {@code 45m}; averages are rendered as
 * {@code 0d 1h 30m}. Minutes are whole and floored.
 */
public final class HoldingDurationFormatter {

    /** Holding time of a trade whose opening event is unknown. */
    public static final String UNKNOWN = "-";

    private static final Pattern DAYS = Pattern.compile("(\\d+)d");
    private static final Pattern HOURS = Pattern.compile("(\\d+)h");
    private static final Pattern MINUTES = Pattern.compile("(\\d+)m");

    private HoldingDurationFormatter() {}

    /** Empty when {@code closedAt} precedes {@code openedAt}. */
    public static Optional<String> format(Instant openedAt, Instant closedAt) {
        if (openedAt == null || closedAt == null || closedAt.isBefore(openedAt)) {
            return Optional.empty();
        }
        long minutes = Duration.between(openedAt, closedAt).toMinutes();
        long hours = minutes / 60;
        return Optional.of(hours > 0 ? hours + "h " + (minutes % 60) + "m" : minutes + "m");
    }

    /** Total minutes of a display string; {@link #UNKNOWN} and unparseable text count as 0. */
    public static long parseMinutes(String holdingDuration) {
        if (holdingDuration == null) {
            return 0;
        }
        return component(DAYS, holdingDuration) * 24 * 60
                + component(HOURS, holdingDuration) * 60
                + component(MINUTES, holdingDuration);
    }

    public static String renderAverage(long minutes) {
        long days = minutes / (24 * 60);
        long hours = (minutes % (24 * 60)) / 60;
        return days + "d " + hours + "h " + (minutes % 60) + "m";
    }

    private static long component(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Long.parseLong(matcher.group(1)) : 0;
    }
}
