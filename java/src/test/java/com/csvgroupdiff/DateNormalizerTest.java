package com.csvgroupdiff;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

class DateNormalizerTest {

    private final DateNormalizer normalizer = new DateNormalizer();

    private String normalize(String text) {
        return normalizer.normalize(CellValue.of(text)).display();
    }

    @Test
    void zonedTimestampWithSpace_keepsOnlyTheDate() {
        assertEquals("2024-01-05", normalize("2024-01-05 10:00:00.000000+00:00"));
        assertEquals("2024-01-05", normalize("2024-01-05 23:59:59+05:30"));
    }

    @Test
    void isoDateTime_keepsTimeAndDropsPositiveOffset() {
        assertEquals("2024-01-05T10:00:00", normalize("2024-01-05T10:00:00+00:00"));
        assertEquals("2024-01-05T10:00:00", normalize("2024-01-05T10:00:00Z"));
        assertEquals("2024-01-05T10:00:00", normalize("2024-01-05T10:00:00+0530"));
    }

    @Test
    void negativeOffset_isKept() {
        assertEquals("2024-01-05T10:00:00-05:00", normalize("2024-01-05T10:00:00-05:00"));
    }

    @Test
    void dateTimeWithoutSeconds_getsSeconds() {
        assertEquals("2024-01-05T10:00:00", normalize("2024-01-05 10:00"));
        assertEquals("2024-01-05T10:30:00", normalize("2024/01/05 10:30"));
        assertEquals("2024-01-05T08:15:00", normalize("01/05/2024 08:15:00"));
    }

    @Test
    void fractions_printAsMicrosecondsUnlessFiner() {
        assertEquals("2024-01-05T10:00:00.500000", normalize("2024-01-05T10:00:00.5"));
        assertEquals("2024-01-05T10:00:00.000000001", normalize("2024-01-05T10:00:00.000000001"));
        assertEquals("2024-01-05T10:00:00", normalize("2024-01-05T10:00:00.000"));
    }

    @Test
    void bareDates_becomeIsoDates() {
        assertEquals("2024-01-05", normalize("2024-01-05"));
        assertEquals("2024-01-05", normalize("2024/01/05"));
        assertEquals("2024-01-05", normalize("01/05/2024"));
    }

    @Test
    void impossibleDates_areLeftUnchanged() {
        assertEquals("2024-02-30", normalize("2024-02-30"));
        assertEquals("13/01/2024", normalize("13/01/2024"));
    }

    @Test
    void nonDates_numbersAndMissing_passThrough() {
        assertEquals("hello", normalize("hello"));
        assertEquals("Q1 2024", normalize("Q1 2024"));
        assertEquals(CellValue.number(20240105), normalizer.normalize(CellValue.number(20240105)));
        assertTrue(normalizer.normalize(CellValue.missing()).isMissing());
    }

    @Test
    void spaceAndTSeparators_normalizeDifferentlyWhenZoned() {
        // Only the space-separated zoned form loses its time of day.
        assertNotEquals(normalize("2024-01-05 10:00:00+00:00"), normalize("2024-01-05T10:00:00+00:00"));
    }

    @Test
    void normalize_isIdempotent() {
        List<String> samples = List.of(
                "2024-01-05 10:00:00.000000+00:00",
                "2024-01-05T10:00:00+00:00",
                "2024-01-05T10:00:00-05:00",
                "2024-01-05T10:00:00.5",
                "2024-01-05 10:00",
                "2024/01/05 10:30",
                "01/05/2024",
                "2024-02-30",
                "plain text");
        for (String sample : samples) {
            CellValue once = normalizer.normalize(CellValue.of(sample));
            assertEquals(once, normalizer.normalize(once), sample);
        }
    }

    @Test
    void customPatterns_replaceDefaults() {
        DateNormalizer dayFirst = new DateNormalizer(List.of(), List.of("dd.MM.uuuu"));

        assertEquals("2024-01-05", dayFirst.normalize(CellValue.of("05.01.2024")).display());
        assertEquals("01/05/2024", dayFirst.normalize(CellValue.of("01/05/2024")).display());
    }
}
