package com.agentledger.io;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Normalizes the timestamp shapes the agent writes into {@link Instant}.
 *
 * <p>Accepted: ISO-8601 with offset ({@code 2024-01-01T12:00:00.123+00:00},
 * {@code ...Z}), ISO local date-time, the space-separated form used by Python
 * logging and the prompt log, and a comma before the fraction
 * ({@code 2024-01-01 12:00:00,123}). Zone-less values are read in {@code zone}.
 */
public final class TimestampParser {

    private TimestampParser() {}

    public static Optional<Instant> parse(String raw, ZoneId zone) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().replace(',', '.');
        if (normalized.length() > 10 && normalized.charAt(10) == ' ') {
            normalized = normalized.substring(0, 10) + 'T' + normalized.substring(11);
        }
        Optional<Instant> withOffset = parseWithOffset(normalized);
        if (withOffset.isPresent()) {
            return withOffset;
        }
        return parseLocal(normalized, zone);
    }

    private static Optional<Instant> parseWithOffset(String value) {
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseLocal(String value, ZoneId zone) {
        try {
            return Optional.of(LocalDateTime.parse(value).atZone(zone).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
