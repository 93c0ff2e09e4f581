package com.postscraper.scrape.util;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PostDates {
    // "Wed Jan 08 20:25:00 +0000 2026"; the weekday is matched but not cross-checked against the date
    private static final Pattern NATIVE_PATTERN =
        Pattern.compile("^[A-Za-z]{3}\\s+([A-Za-z]{3}\\s+\\d{1,2}\\s+\\d{2}:\\d{2}:\\d{2}\\s+[+-]\\d{4}\\s+\\d{4})$");
    private static final DateTimeFormatter NATIVE_FORMAT =
        DateTimeFormatter.ofPattern("MMM d HH:mm:ss Z yyyy", Locale.ENGLISH);

    private PostDates() {}

    public static OffsetDateTime parse(String value) {
        return parse(value, Clock.systemUTC());
    }

    /**
     * Native bird format, then ISO-8601, then the current time. Never throws.
     */
    public static OffsetDateTime parse(String value, Clock clock) {
        if (value != null && !value.isBlank()) {
            String trimmed = value.trim();
            OffsetDateTime parsed = parseNative(trimmed);
            if (parsed == null) {
                parsed = parseIso(trimmed);
            }
            if (parsed != null) {
                return parsed;
            }
        }
        return OffsetDateTime.now(clock);
    }

    static OffsetDateTime parseNative(String value) {
        Matcher matcher = NATIVE_PATTERN.matcher(value);
        if (!matcher.matches()) {
            return null;
        }
        String withoutWeekday = matcher.group(1).replaceAll("\\s+", " ");
        try {
            return OffsetDateTime.parse(withoutWeekday, NATIVE_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static OffsetDateTime parseIso(String value) {
        String normalized = value.endsWith("Z")
            ? value.substring(0, value.length() - 1) + "+00:00"
            : value;
        try {
            return OffsetDateTime.parse(normalized);
        } catch (DateTimeParseException ignored) {
            // no offset; read it as UTC below
        }
        try {
            return LocalDateTime.parse(normalized).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // maybe a bare date
        }
        try {
            return LocalDate.parse(normalized).atStartOfDay().atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
