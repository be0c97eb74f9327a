package com.opsdata.reconciliation.normalize;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class FieldNormalizer {

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern SLASH_DATE = Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{4})$");
    private static final Pattern NUMERIC_ID = Pattern.compile("^0+(?=\\d+$)");
    private static final Pattern LEADING_ZEROS = Pattern.compile("^[0\\s]+");
    private static final Pattern LEADING_INTEGER = Pattern.compile("^[+-]?\\d+");

    private static final Set<String> TRUE_VALUES = Set.of("yes", "y", "true", "pass", "1");
    private static final Set<String> FALSE_VALUES = Set.of("no", "n", "false", "fail", "0");

    private static final List<DateTimeFormatter> FALLBACK_FORMATS = List.of(
        strict("d/M/uuuu"),
        strict("uuuu/M/d"),
        strict("M-d-uuuu"),
        strict("d.M.uuuu"),
        strict("uuuuMMdd"),
        strict("MMM d, uuuu"),
        strict("d MMM uuuu"),
        strict("MMMM d, uuuu")
    );

    private FieldNormalizer() {
    }

    public static Object trim(Object value) {
        return value instanceof String text ? text.trim() : value;
    }

    public static String text(Object value) {
        if (value == null) {
            return "";
        }
        return String.valueOf(value).trim();
    }

    public static String text(Object value, String fallback) {
        String text = text(value);
        return text.isEmpty() ? fallback : text;
    }

    public static Object stripLeadingZeros(Object value) {
        if (!(value instanceof String text)) {
            return value;
        }
        return NUMERIC_ID.matcher(text).replaceFirst("");
    }

    public static String cleanLotCode(Object value) {
        String trimmed = text(value);
        if (trimmed.isEmpty()) {
            return "";
        }
        String stripped = LEADING_ZEROS.matcher(trimmed).replaceFirst("");
        return stripped.isEmpty() ? "0" : stripped;
    }

    public static Optional<LocalDate> canonicalDate(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof LocalDate date) {
            return Optional.of(date);
        }
        if (value instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        if (value instanceof OffsetDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        if (value instanceof ZonedDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        if (value instanceof Instant instant) {
            return Optional.of(LocalDate.ofInstant(instant, ZoneOffset.UTC));
        }
        if (value instanceof java.sql.Date sqlDate) {
            return Optional.of(sqlDate.toLocalDate());
        }
        if (value instanceof Date date) {
            return Optional.of(LocalDate.ofInstant(date.toInstant(), ZoneOffset.UTC));
        }
        if (!(value instanceof String raw)) {
            return Optional.empty();
        }

        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        if (ISO_DATE.matcher(trimmed).matches()) {
            return parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE);
        }

        // a/b/yyyy is month-first; day-first only through the fallbacks when that is not a valid date.
        Matcher slash = SLASH_DATE.matcher(trimmed);
        if (slash.matches()) {
            Optional<LocalDate> monthFirst = ofParts(slash.group(3), slash.group(1), slash.group(2));
            if (monthFirst.isPresent()) {
                return monthFirst;
            }
        }
        return genericParse(trimmed);
    }

    public static boolean toBoolean(Object value, boolean defaultValue) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value == null) {
            return defaultValue;
        }
        String normalized = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(normalized)) {
            return true;
        }
        if (FALSE_VALUES.contains(normalized)) {
            return false;
        }
        return defaultValue;
    }

    public static int toInteger(Object value, int defaultValue) {
        if (value instanceof Number number) {
            double floored = Math.floor(number.doubleValue());
            if (Double.isNaN(floored) || floored > Integer.MAX_VALUE || floored < Integer.MIN_VALUE) {
                return defaultValue;
            }
            return (int) floored;
        }
        if (value == null) {
            return defaultValue;
        }
        Matcher matcher = LEADING_INTEGER.matcher(String.valueOf(value).trim());
        if (!matcher.find()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(matcher.group());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    private static Optional<LocalDate> genericParse(String value) {
        for (DateTimeFormatter format : FALLBACK_FORMATS) {
            Optional<LocalDate> parsed = parse(value, format);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return parse(value, DateTimeFormatter.ISO_DATE_TIME);
    }

    private static Optional<LocalDate> ofParts(String year, String month, String day) {
        try {
            return Optional.of(LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day)));
        } catch (RuntimeException ex) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDate> parse(String value, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDate.from(format.parse(value)));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }
}
