package com.ledgerlens.common;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date parsing for text read off Chilean documents: day-first by default, year-first when the first group
 * cannot be a day.
 */
public final class LenientDates {

    private static final Pattern DATE_PATTERN =
            Pattern.compile("(?<!\\d)(\\d{1,4})[-/](\\d{1,2})[-/](\\d{1,4})(?!\\d)");

    private LenientDates() {
    }

    /**
     * "05/03/2024", "5-3-24" and "2024-03-05" all parse to 2024-03-05. Two-digit years are normalized to 20xx;
     * invalid calendar dates are rejected.
     */
    public static Optional<LocalDate> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Matcher m = DATE_PATTERN.matcher(raw);
        if (m.find()) {
            int first = Integer.parseInt(m.group(1));
            int second = Integer.parseInt(m.group(2));
            int third = Integer.parseInt(m.group(3));
            try {
                if (first > 31) {
                    return Optional.of(LocalDate.of(first, second, third));
                }
                int year = third < 100 ? third + 2000 : third;
                return Optional.of(LocalDate.of(year, second, first));
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        }
        try {
            return Optional.of(LocalDate.parse(raw.trim()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /** Most recent parseable date not after {@code today}. */
    public static Optional<LocalDate> latestNotAfter(Collection<String> raw, LocalDate today) {
        return raw.stream()
                .filter(Objects::nonNull)
                .map(LenientDates::parse)
                .flatMap(Optional::stream)
                .filter(d -> !d.isAfter(today))
                .max(Comparator.naturalOrder());
    }
}
