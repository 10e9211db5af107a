package com.example.dsload.processor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

public class FuzzyDateParserTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "2024-01-31|2024-01-31",
            "2024/1/5|2024-01-05",
            "2024-01-31 00:00:00|2024-01-31",
            "20240131|2024-01-31",
            "31.01.2024|2024-01-31",
            "01.02.2024|2024-02-01",
            "01/02/2024|2024-02-01",
            "5-3-2024|2024-03-05",
            "31.12.17|2017-12-31",
            "01.01.99|1999-01-01",
            "12/31/2024|2024-12-31",
            "31.01.2024 г.|2024-01-31",
            "1 Jan 2024|2024-01-01",
            "15-March-2023|2023-03-15",
            "Jan 5, 2024|2024-01-05",
            "January 31 2024|2024-01-31",
            "2024-31-01|2024-01-31",
            "2024/13/01|2024-01-13"
    })
    public void testParsesKnownShapes(String text, String expected) {
        assertThat(FuzzyDateParser.parse(text)).contains(LocalDate.parse(expected));
    }

    @ParameterizedTest
    @ValueSource(strings = {"not a date", "2024-13-45", "31.31.2024", "99999999", "1 Foo 2024", "abc-01"})
    public void testRejectsGarbage(String text) {
        assertThat(FuzzyDateParser.parse(text)).isEmpty();
    }

    @Test
    public void testBlankIsNoValue() {
        assertThat(FuzzyDateParser.parse(null)).isEmpty();
        assertThat(FuzzyDateParser.parse("   ")).isEmpty();
    }
}
