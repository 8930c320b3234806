package com.csvgroupdiff;

import static java.time.temporal.ChronoField.HOUR_OF_DAY;
import static java.time.temporal.ChronoField.MINUTE_OF_HOUR;
import static java.time.temporal.ChronoField.NANO_OF_SECOND;
import static java.time.temporal.ChronoField.OFFSET_SECONDS;
import static java.time.temporal.ChronoField.SECOND_OF_MINUTE;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Rewrites date and timestamp text into a canonical form so that differently
 * formatted values can be compared.
 * <p>
 * Stages, first match wins:
 * <ol>
 * <li>text longer than 19 characters with a space at offset 10 and a {@code +}
 * somewhere is a zoned timestamp; only its first 10 characters (the date) are kept</li>
 * <li>a date-time with a time of day becomes {@code yyyy-MM-ddTHH:mm:ss[.ffffff]},
 * offset appended, then cut at the first {@code +}</li>
 * <li>a bare date becomes {@code yyyy-MM-dd}</li>
 * <li>anything else is returned unchanged</li>
 * </ol>
 * Only stage 1 drops the time of day. Numbers and missing cells pass through.
 * Patterns use {@code uuuu} for the year and are resolved strictly.
 */
public class DateNormalizer {

    public static final List<String> DEFAULT_DATETIME_PATTERNS = List.of(
            "uuuu/MM/dd HH:mm[:ss]",
            "MM/dd/uuuu HH:mm[:ss]");

    public static final List<String> DEFAULT_DATE_PATTERNS = List.of(
            "uuuu-MM-dd",
            "uuuu/MM/dd",
            "MM/dd/uuuu");

    private static final DateTimeFormatter ISO_DATE_TIME = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .appendValue(HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(MINUTE_OF_HOUR, 2)
            .optionalStart()
            .appendLiteral(':')
            .appendValue(SECOND_OF_MINUTE, 2)
            .optionalStart().appendFraction(NANO_OF_SECOND, 0, 9, true).optionalEnd()
            .optionalEnd()
            .appendPattern("[XXX][XX][X]")
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter OUTPUT_SECONDS = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss",
            Locale.ROOT);

    private final List<DateTimeFormatter> dateTimeFormats;
    private final List<DateTimeFormatter> dateFormats;

    public DateNormalizer() {
        this(DEFAULT_DATETIME_PATTERNS, DEFAULT_DATE_PATTERNS);
    }

    public DateNormalizer(List<String> dateTimePatterns, List<String> datePatterns) {
        this.dateTimeFormats = new ArrayList<>();
        this.dateTimeFormats.add(ISO_DATE_TIME);
        for (String pattern : dateTimePatterns) {
            this.dateTimeFormats.add(compile(pattern));
        }
        this.dateFormats = new ArrayList<>();
        for (String pattern : datePatterns) {
            this.dateFormats.add(compile(pattern));
        }
    }

    private static DateTimeFormatter compile(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }

    public CellValue normalize(CellValue value) {
        if (!value.isText()) {
            return value;
        }
        String text = value.text();
        if (text.length() > 19 && text.charAt(10) == ' ' && text.contains("+")) {
            return CellValue.of(text.substring(0, 10));
        }
        String dateTime = parseDateTime(text);
        if (dateTime != null) {
            return CellValue.of(dateTime);
        }
        String date = parseDate(text);
        if (date != null) {
            return CellValue.of(date);
        }
        return value;
    }

    private String parseDateTime(String text) {
        for (DateTimeFormatter format : dateTimeFormats) {
            Optional<TemporalAccessor> parsed = tryParse(format, text);
            if (parsed.isEmpty()) {
                continue;
            }
            TemporalAccessor temporal = parsed.get();
            String iso = isoFormat(LocalDateTime.from(temporal));
            if (temporal.isSupported(OFFSET_SECONDS)) {
                iso += offsetSuffix(ZoneOffset.ofTotalSeconds(temporal.get(OFFSET_SECONDS)));
            }
            int plus = iso.indexOf('+');
            return plus >= 0 ? iso.substring(0, plus) : iso;
        }
        return null;
    }

    private String parseDate(String text) {
        for (DateTimeFormatter format : dateFormats) {
            Optional<TemporalAccessor> parsed = tryParse(format, text);
            if (parsed.isPresent()) {
                return LocalDate.from(parsed.get()).toString();
            }
        }
        return null;
    }

    private static Optional<TemporalAccessor> tryParse(DateTimeFormatter format, String text) {
        try {
            return Optional.of(format.parse(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    // Seconds always present; fraction printed as 6 digits, or 9 when sub-microsecond.
    private static String isoFormat(LocalDateTime local) {
        String base = OUTPUT_SECONDS.format(local);
        int nanos = local.getNano();
        if (nanos == 0) {
            return base;
        }
        if (nanos % 1000 == 0) {
            return base + String.format(Locale.ROOT, ".%06d", nanos / 1000);
        }
        return base + String.format(Locale.ROOT, ".%09d", nanos);
    }

    private static String offsetSuffix(ZoneOffset offset) {
        return offset.getTotalSeconds() == 0 ? "+00:00" : offset.getId();
    }
}
