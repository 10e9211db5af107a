package com.example.dsload.processor;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Day-first, noise-tolerant date parser for legacy exports. The first date-looking token in the
 * text wins, so {@code "2024-01-31 00:00:00"} or {@code "31.01.2024 г."} still resolve.
 */
public final class FuzzyDateParser {

    private static final Pattern YEAR_FIRST =
            Pattern.compile("(?<!\\d)(\\d{4})([-/.])(\\d{1,2})\\2(\\d{1,2})(?!\\d)");
    private static final Pattern COMPACT = Pattern.compile("(?<!\\d)(\\d{4})(\\d{2})(\\d{2})(?!\\d)");
    private static final Pattern DAY_FIRST =
            Pattern.compile("(?<!\\d)(\\d{1,2})([-/.])(\\d{1,2})\\2(\\d{4}|\\d{2})(?!\\d)");
    private static final Pattern MONTH_NAME =
            Pattern.compile("(?<!\\d)(\\d{1,2})[\\s-]+([A-Za-z]{3,9})\\.?[\\s,-]+(\\d{4})(?!\\d)");
    private static final Pattern MONTH_NAME_FIRST =
            Pattern.compile("(?<![A-Za-z])([A-Za-z]{3,9})\\.?[\\s-]+(\\d{1,2})(?:st|nd|rd|th)?,?[\\s-]+(\\d{4})(?!\\d)");

    private static final Map<String, Month> MONTHS = Stream.of(Month.values())
            .flatMap(m -> Stream.of(
                    Map.entry(m.name().toLowerCase(Locale.ROOT), m),
                    Map.entry(m.name().substring(0, 3).toLowerCase(Locale.ROOT), m)))
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a));

    // Two-digit years below this pivot belong to the 2000s
    private static final int TWO_DIGIT_YEAR_PIVOT = 70;

    private FuzzyDateParser() {}

    public static Optional<LocalDate> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher m = YEAR_FIRST.matcher(text);
        if (m.find()) {
            int year = Integer.parseInt(m.group(1));
            int second = Integer.parseInt(m.group(3));
            int third = Integer.parseInt(m.group(4));
            Optional<LocalDate> monthFirst = date(year, second, third);
            return monthFirst.isPresent() ? monthFirst : date(year, third, second);
        }
        m = COMPACT.matcher(text);
        if (m.find()) {
            return date(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
        }
        m = DAY_FIRST.matcher(text);
        if (m.find()) {
            int first = Integer.parseInt(m.group(1));
            int second = Integer.parseInt(m.group(3));
            int year = expandYear(m.group(4));
            Optional<LocalDate> dayFirst = date(year, second, first);
            return dayFirst.isPresent() ? dayFirst : date(year, first, second);
        }
        m = MONTH_NAME.matcher(text);
        if (m.find()) {
            Month month = MONTHS.get(m.group(2).toLowerCase(Locale.ROOT));
            if (month != null) {
                return date(Integer.parseInt(m.group(3)), month.getValue(), Integer.parseInt(m.group(1)));
            }
        }
        m = MONTH_NAME_FIRST.matcher(text);
        while (m.find()) {
            Month month = MONTHS.get(m.group(1).toLowerCase(Locale.ROOT));
            if (month != null) {
                return date(Integer.parseInt(m.group(3)), month.getValue(), Integer.parseInt(m.group(2)));
            }
        }
        return Optional.empty();
    }

    private static int expandYear(String year) {
        int value = Integer.parseInt(year);
        if (year.length() == 2) {
            return value < TWO_DIGIT_YEAR_PIVOT ? 2000 + value : 1900 + value;
        }
        return value;
    }

    private static Optional<LocalDate> date(int year, int month, int day) {
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
