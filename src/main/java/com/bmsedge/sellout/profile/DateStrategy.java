package com.bmsedge.sellout.profile;

import com.bmsedge.sellout.util.MonthNameUtil;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * How a source tells which month a report covers.
 * File-level strategies read the filename (and preamble cells where noted); the row and
 * per-column strategies carry the period in the data itself.
 */
public enum DateStrategy {

    /** MONTH and YEAR columns on every row. */
    ROW_COLUMNS {
        @Override
        public boolean isFileLevel() {
            return false;
        }

        @Override
        protected Optional<YearMonth> fromFilename(String filename, List<List<String>> preamble) {
            return Optional.empty();
        }
    },

    /** Each period column header names its month. */
    PER_COLUMN {
        @Override
        public boolean isFileLevel() {
            return false;
        }

        @Override
        protected Optional<YearMonth> fromFilename(String filename, List<List<String>> preamble) {
            return Optional.empty();
        }
    },

    /** "BIBBIPARFU_ReportPeriod02-2025.xlsx" */
    REPORT_PERIOD {
        private final Pattern pattern = Pattern.compile("(?i)ReportPeriod(\\d{2})-(\\d{4})");

        @Override
        protected Optional<YearMonth> fromFilename(String filename, List<List<String>> preamble) {
            Matcher matcher = pattern.matcher(filename);
            if (!matcher.find()) {
                return Optional.empty();
            }
            return yearMonth(Integer.parseInt(matcher.group(2)), Integer.parseInt(matcher.group(1)));
        }
    },

    /** "... Monthly Sales Report APR2025" */
    MONTH_TOKEN_YEAR {
        private final Pattern pattern = Pattern.compile("([A-Z]{3,9})[\\s_-]?(\\d{4})(?!\\d)");

        @Override
        protected Optional<YearMonth> fromFilename(String filename, List<List<String>> preamble) {
            Matcher matcher = pattern.matcher(filename.toUpperCase(Locale.ROOT));
            while (matcher.find()) {
                Optional<Integer> month = MonthNameUtil.monthNumber(matcher.group(1));
                if (month.isPresent()) {
                    return yearMonth(Integer.parseInt(matcher.group(2)), month.get());
                }
            }
            return Optional.empty();
        }
    },

    /** A 4-digit year anywhere in the name plus the first month-name token, "Skins SA 2025 March". */
    YEAR_AND_MONTH_NAME {
        private final Pattern year = Pattern.compile("(?<!\\d)(\\d{4})(?!\\d)");
        private final Pattern word = Pattern.compile("\\p{L}+");

        @Override
        protected Optional<YearMonth> fromFilename(String filename, List<List<String>> preamble) {
            Matcher yearMatcher = year.matcher(filename);
            if (!yearMatcher.find()) {
                return Optional.empty();
            }
            Matcher wordMatcher = word.matcher(filename);
            while (wordMatcher.find()) {
                Optional<Integer> month = MonthNameUtil.monthNumber(wordMatcher.group());
                if (month.isPresent()) {
                    return yearMonth(Integer.parseInt(yearMatcher.group(1)), month.get());
                }
            }
            return Optional.empty();
        }
    },

    /** "CDLC BIBBI 2025 03.xlsx", otherwise "2025 March" in preamble cell B2. */
    YEAR_MONTH_DIGITS {
        private final Pattern digits = Pattern.compile("(?<!\\d)(\\d{4})\\s+(\\d{2})(?!\\d)");
        private final Pattern preambleCell = Pattern.compile("(\\d{4})\\s+(\\p{L}+)");

        @Override
        protected Optional<YearMonth> fromFilename(String filename, List<List<String>> preamble) {
            Matcher matcher = digits.matcher(filename);
            if (matcher.find()) {
                Optional<YearMonth> period = yearMonth(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
                if (period.isPresent()) {
                    return period;
                }
            }
            if (preamble == null || preamble.size() < 2 || preamble.get(1).size() < 2) {
                return Optional.empty();
            }
            Matcher cell = preambleCell.matcher(preamble.get(1).get(1));
            if (!cell.find()) {
                return Optional.empty();
            }
            return MonthNameUtil.monthNumber(cell.group(2))
                    .flatMap(month -> yearMonth(Integer.parseInt(cell.group(1)), month));
        }
    },

    /** Weekly report dated "DD-MM-YYYY"; the covered week starts seven days earlier. */
    WEEKLY_MINUS_ONE_WEEK {
        private final Pattern pattern = Pattern.compile("(?<!\\d)(\\d{2})[-_.](\\d{2})[-_.](\\d{4})(?!\\d)");

        @Override
        protected Optional<YearMonth> fromFilename(String filename, List<List<String>> preamble) {
            Matcher matcher = pattern.matcher(filename);
            if (!matcher.find()) {
                return Optional.empty();
            }
            try {
                LocalDate reportDate = LocalDate.of(Integer.parseInt(matcher.group(3)),
                        Integer.parseInt(matcher.group(2)), Integer.parseInt(matcher.group(1)));
                LocalDate covered = reportDate.minusWeeks(1);
                return yearMonth(covered.getYear(), covered.getMonthValue());
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        }
    },

    /** "Aromateque March'25" */
    MONTH_APOSTROPHE_YEAR {
        private final Pattern pattern = Pattern.compile("(\\p{L}+)['’\\s]?(\\d{2})(?!\\d)");

        @Override
        protected Optional<YearMonth> fromFilename(String filename, List<List<String>> preamble) {
            Matcher matcher = pattern.matcher(filename);
            while (matcher.find()) {
                Optional<Integer> month = MonthNameUtil.monthNumber(matcher.group(1));
                if (month.isPresent()) {
                    return yearMonth(MonthNameUtil.expandYear(matcher.group(2)), month.get());
                }
            }
            return Optional.empty();
        }
    },

    /** Year only, the first 20YY in the filename. Used as a year fallback for wide sources. */
    FILENAME_YEAR {
        private final Pattern pattern = Pattern.compile("(?<!\\d)(20\\d{2})(?!\\d)");

        @Override
        protected Optional<YearMonth> fromFilename(String filename, List<List<String>> preamble) {
            return Optional.empty();
        }

        @Override
        public Optional<Integer> deriveYear(String filename, List<List<String>> preamble) {
            if (filename == null) {
                return Optional.empty();
            }
            Matcher matcher = pattern.matcher(filename);
            return matcher.find() ? Optional.of(Integer.parseInt(matcher.group(1))) : Optional.empty();
        }
    };

    public static final int MIN_YEAR = 2000;

    public boolean isFileLevel() {
        return true;
    }

    /**
     * Derives the report month. Empty when the strategy does not apply to this file
     * or yields a year before 2000.
     */
    public Optional<YearMonth> derive(String filename, List<List<String>> preamble) {
        return fromFilename(filename == null ? "" : filename, preamble);
    }

    public Optional<Integer> deriveYear(String filename, List<List<String>> preamble) {
        return derive(filename, preamble).map(YearMonth::getYear);
    }

    protected abstract Optional<YearMonth> fromFilename(String filename, List<List<String>> preamble);

    static Optional<YearMonth> yearMonth(int year, int month) {
        if (year < MIN_YEAR || month < 1 || month > 12) {
            return Optional.empty();
        }
        return Optional.of(YearMonth.of(year, month));
    }
}
