package com.opsdata.reconciliation.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("FieldNormalizer")
class FieldNormalizerTest {

    @ParameterizedTest
    @CsvSource({
        "00LOT123, LOT123",
        "'  00LOT123  ', LOT123",
        "000, 0",
        "0, 0",
        "LOT-9, LOT-9",
        "00LOT-9, LOT-9",
        "0012, 12",
        "A0012, A0012",
        "'0 0LOT-4', LOT-4"
    })
    @DisplayName("cleanLotCode trims and drops leading zeros")
    void cleanLotCode(String input, String expected) {
        assertThat(FieldNormalizer.cleanLotCode(input)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\t"})
    @DisplayName("cleanLotCode keeps blank codes empty")
    void cleanLotCodeBlank(String input) {
        assertThat(FieldNormalizer.cleanLotCode(input)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "00123, 123",
        "000, 0",
        "0, 0",
        "00ABC, 00ABC",
        "123, 123"
    })
    @DisplayName("stripLeadingZeros never empties a numeric identifier")
    void stripLeadingZeros(String input, String expected) {
        assertThat(FieldNormalizer.stripLeadingZeros(input)).isEqualTo(expected);
    }

    @Test
    @DisplayName("trim leaves non-string values untouched")
    void trimNonString() {
        assertThat(FieldNormalizer.trim(42)).isEqualTo(42);
        assertThat(FieldNormalizer.trim(null)).isNull();
        assertThat(FieldNormalizer.trim("  x ")).isEqualTo("x");
    }

    @ParameterizedTest
    @CsvSource({
        "2026-02-10, 2026-02-10",
        "02/10/2026, 2026-02-10",
        "2/3/2026, 2026-02-03",
        "' 02/10/2026 ', 2026-02-10",
        "13/02/2026, 2026-02-13",
        "2026/02/10, 2026-02-10",
        "02-10-2026, 2026-02-10",
        "10.02.2026, 2026-02-10",
        "20260210, 2026-02-10",
        "'Feb 10, 2026', 2026-02-10",
        "'10 Feb 2026', 2026-02-10",
        "2026-02-10T08:30:00Z, 2026-02-10"
    })
    @DisplayName("canonicalDate reads ISO, month-first slashes and fallback formats")
    void canonicalDate(String input, LocalDate expected) {
        assertThat(FieldNormalizer.canonicalDate(input)).contains(expected);
    }

    @Test
    @DisplayName("canonicalDate resolves ambiguous slash dates month first")
    void ambiguousSlashDateIsMonthFirst() {
        assertThat(FieldNormalizer.canonicalDate("03/04/2026")).contains(LocalDate.of(2026, 3, 4));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "not a date", "2026-13-01", "02/30/2026", "31/31/2026", "2026-02-30"})
    @DisplayName("canonicalDate returns empty for unparseable values")
    void canonicalDateInvalid(String input) {
        assertThat(FieldNormalizer.canonicalDate(input)).isEmpty();
    }

    @Test
    @DisplayName("canonicalDate accepts native date values")
    void canonicalDateNative() {
        assertThat(FieldNormalizer.canonicalDate(LocalDate.of(2026, 2, 10))).contains(LocalDate.of(2026, 2, 10));
        assertThat(FieldNormalizer.canonicalDate(LocalDateTime.of(2026, 2, 10, 23, 59))).contains(LocalDate.of(2026, 2, 10));
        assertThat(FieldNormalizer.canonicalDate(Instant.parse("2026-02-10T23:00:00Z"))).contains(LocalDate.of(2026, 2, 10));
        assertThat(FieldNormalizer.canonicalDate(null)).isEmpty();
        assertThat(FieldNormalizer.canonicalDate(12345)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "yes, false, true",
        "Y, false, true",
        "TRUE, false, true",
        "Pass, false, true",
        "1, false, true",
        "no, true, false",
        "n, true, false",
        "False, true, false",
        "FAIL, true, false",
        "0, true, false",
        "maybe, true, true",
        "maybe, false, false",
        "'', true, true"
    })
    @DisplayName("toBoolean maps known words and falls back to the default")
    void toBoolean(String input, boolean defaultValue, boolean expected) {
        assertThat(FieldNormalizer.toBoolean(input, defaultValue)).isEqualTo(expected);
    }

    @Test
    @DisplayName("toBoolean passes native booleans and null")
    void toBooleanNative() {
        assertThat(FieldNormalizer.toBoolean(Boolean.TRUE, false)).isTrue();
        assertThat(FieldNormalizer.toBoolean(null, true)).isTrue();
    }

    @Test
    @DisplayName("toBoolean and header keys ignore a Turkish default locale")
    void caseFoldingIsLocaleIndependent() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(FieldNormalizer.toBoolean("FAIL", true)).isFalse();
            assertThat(FieldNormalizer.toBoolean("YES", false)).isTrue();
            assertThat(SourceField.headerKey("LOT ID")).isEqualTo("lotid");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @ParameterizedTest
    @CsvSource({
        "42, 42",
        "' 42 ', 42",
        "42 units, 42",
        "-7, -7",
        "+8, 8",
        "3.9, 3",
        "abc, -1",
        "'', -1",
        "99999999999, -1"
    })
    @DisplayName("toInteger parses the leading integer")
    void toInteger(String input, int expected) {
        assertThat(FieldNormalizer.toInteger(input, -1)).isEqualTo(expected);
    }

    @Test
    @DisplayName("toInteger floors native numbers")
    void toIntegerNative() {
        assertThat(FieldNormalizer.toInteger(90, 0)).isEqualTo(90);
        assertThat(FieldNormalizer.toInteger(90.7d, 0)).isEqualTo(90);
        assertThat(FieldNormalizer.toInteger(Double.NaN, 5)).isEqualTo(5);
        assertThat(FieldNormalizer.toInteger(null, 5)).isEqualTo(5);
    }
}
