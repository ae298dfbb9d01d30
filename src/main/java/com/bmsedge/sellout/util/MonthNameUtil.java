package com.bmsedge.sellout.util;

import lombok.Value;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Month names as they show up in reseller headers and filenames:
 * English full names and abbreviations, Ukrainian nominative and genitive forms.
 */
public class MonthNameUtil {

    private static final Map<String, Integer> MONTHS = new HashMap<>();

    private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4})-(\\d{1,2})(?:-(\\d{1,2}))?(?:T.*)?$");
    private static final Pattern DOTTED_DATE = Pattern.compile("^(\\d{1,2})[./](\\d{1,2})[./](\\d{4})$");
    private static final Pattern NAME_AND_YEAR = Pattern.compile("^(\\p{L}+)\\.?[\\s\\-'’/]*(\\d{4}|\\d{2})?$");

    static {
        addMonth(1, "january", "jan", "січень", "січня");
        addMonth(2, "february", "feb", "лютий", "лютого");
        addMonth(3, "march", "mar", "березень", "березня");
        addMonth(4, "april", "apr", "квітень", "квітня");
        addMonth(5, "may", "травень", "травня");
        addMonth(6, "june", "jun", "червень", "червня");
        addMonth(7, "july", "jul", "липень", "липня");
        addMonth(8, "august", "aug", "серпень", "серпня");
        addMonth(9, "september", "sep", "sept", "вересень", "вересня");
        addMonth(10, "october", "oct", "жовтень", "жовтня");
        addMonth(11, "november", "nov", "листопад", "листопада");
        addMonth(12, "december", "dec", "грудень", "грудня");
    }

    private static void addMonth(int month, String... names) {
        for (String name : names) {
            MONTHS.put(name, month);
        }
    }

    private MonthNameUtil() {
    }

    public static Optional<Integer> monthNumber(String token) {
        if (token == null) return Optional.empty();
        return Optional.ofNullable(MONTHS.get(token.trim().toLowerCase(Locale.ROOT)));
    }

    public static boolean isMonthName(String token) {
        return monthNumber(token).isPresent();
    }

    /**
     * Reads a period column header such as "Jan", "January 2025", "березня-25", "2025-03-01"
     * or "01.03.2025". Two-digit years are taken as 20YY.
     */
    public static Optional<PeriodLabel> parseMonthLabel(String header) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        String text = header.trim();

        Matcher iso = ISO_DATE.matcher(text);
        if (iso.matches()) {
            return period(Integer.parseInt(iso.group(2)), Integer.parseInt(iso.group(1)));
        }

        Matcher dotted = DOTTED_DATE.matcher(text);
        if (dotted.matches()) {
            return period(Integer.parseInt(dotted.group(2)), Integer.parseInt(dotted.group(3)));
        }

        Matcher named = NAME_AND_YEAR.matcher(text);
        if (named.matches()) {
            Optional<Integer> month = monthNumber(named.group(1));
            if (month.isEmpty()) {
                return Optional.empty();
            }
            Integer year = named.group(2) == null ? null : expandYear(named.group(2));
            return Optional.of(new PeriodLabel(month.get(), year));
        }
        return Optional.empty();
    }

    public static int expandYear(String digits) {
        int year = Integer.parseInt(digits);
        return digits.length() == 2 ? 2000 + year : year;
    }

    private static Optional<PeriodLabel> period(int month, int year) {
        if (month < 1 || month > 12) {
            return Optional.empty();
        }
        return Optional.of(new PeriodLabel(month, year));
    }

    /**
     * A month with an optional year; the year is null when the header only names the month.
     */
    @Value
    public static class PeriodLabel {
        int month;
        Integer year;
    }
}
