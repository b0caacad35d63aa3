package com.aycom.explore.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.function.Function;

/**
 * Ordered fallback chains over loosely shaped upstream JSON. Each path may be dotted
 * ({@code author.username}, {@code metrics.likes}); the first usable value wins.
 */
public final class FieldResolver {
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    private FieldResolver() {
    }

    public static JsonNode at(JsonNode node, String path) {
        if (node == null || path == null) {
            return MissingNode.getInstance();
        }
        JsonNode current = node;
        for (String segment : path.split("\\.")) {
            current = current.path(segment);
            if (current.isMissingNode() || current.isNull()) {
                return MissingNode.getInstance();
            }
        }
        return current;
    }

    public static String text(JsonNode node, String... paths) {
        for (String path : paths) {
            JsonNode value = at(node, path);
            if (value.isTextual() || value.isNumber()) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    public static String textOrDefault(JsonNode node, String fallback, String... paths) {
        String value = text(node, paths);
        return value == null ? fallback : value;
    }

    /**
     * Returns the first value that parses as a number, truncated and floored at zero.
     * Missing or unparsable values fall through; an exhausted chain yields 0.
     */
    public static long count(JsonNode node, String... paths) {
        for (String path : paths) {
            Long parsed = toLong(at(node, path));
            if (parsed != null) {
                return Math.max(0L, parsed);
            }
        }
        return 0L;
    }

    public static Long optionalCount(JsonNode node, String... paths) {
        for (String path : paths) {
            Long parsed = toLong(at(node, path));
            if (parsed != null) {
                return Math.max(0L, parsed);
            }
        }
        return null;
    }

    public static boolean flag(JsonNode node, String... paths) {
        for (String path : paths) {
            JsonNode value = at(node, path);
            if (value.isBoolean()) {
                return value.booleanValue();
            }
            if (value.isNumber()) {
                return value.asLong() != 0L;
            }
            if (value.isTextual()) {
                String text = value.asText().trim().toLowerCase(Locale.ROOT);
                if (text.equals("true") || text.equals("1") || text.equals("yes")) {
                    return true;
                }
                if (text.equals("false") || text.equals("0") || text.equals("no")) {
                    return false;
                }
            }
        }
        return false;
    }

    /**
     * Resolves an instant from ISO-8601 (with or without offset) or epoch seconds/millis.
     * Returns {@code fallback} when no path parses.
     */
    public static Instant timestamp(JsonNode node, Instant fallback, String... paths) {
        for (String path : paths) {
            Instant parsed = toInstant(at(node, path));
            if (parsed != null) {
                return parsed;
            }
        }
        return fallback;
    }

    private static Long toLong(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            double number = value.asDouble();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                return null;
            }
            return (long) number;
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                try {
                    double number = Double.parseDouble(text);
                    if (Double.isNaN(number) || Double.isInfinite(number)) {
                        return null;
                    }
                    return (long) number;
                } catch (NumberFormatException ignored) {
                    return null;
                }
            }
        }
        return null;
    }

    private static Instant toInstant(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return fromEpoch(value.asLong());
        }
        if (!value.isTextual()) {
            return null;
        }
        String text = value.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        Instant parsed = parseOrNull(text, candidate -> OffsetDateTime.parse(candidate).toInstant());
        if (parsed == null) {
            parsed = parseOrNull(text, Instant::parse);
        }
        if (parsed == null) {
            parsed = parseOrNull(text.replace(' ', 'T'), candidate -> LocalDateTime.parse(candidate).toInstant(ZoneOffset.UTC));
        }
        if (parsed == null) {
            Long epoch = toLong(value);
            parsed = epoch == null ? null : fromEpoch(epoch);
        }
        return parsed;
    }

    private static Instant parseOrNull(String text, Function<String, Instant> parser) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Instant fromEpoch(long raw) {
        if (raw <= 0) {
            return null;
        }
        return raw >= EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(raw) : Instant.ofEpochSecond(raw);
    }
}
