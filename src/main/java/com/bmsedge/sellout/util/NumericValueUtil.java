package com.bmsedge.sellout.util;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Coercion of reseller number formats ("202,48", "€ 116", "1,250", "1.234,56").
 */
public class NumericValueUtil {

    private static final Pattern DASHES = Pattern.compile("[\\u2010-\\u2015\\u2212\\uFE63\\uFF0D]");
    private static final Pattern CURRENCY_SYMBOLS = Pattern.compile("zł|[€$£¥₴₽₹]");
    private static final Pattern CURRENCY_CODES = Pattern.compile("(?i)\\b(EUR|USD|GBP|PLN|ZAR|UAH|SEK|NOK|DKK|CHF)\\b");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u2007\\u202F]+");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("^-?\\d+(\\.\\d+)?$");
    private static final Pattern THOUSANDS_GROUPED = Pattern.compile("^-?\\d{1,3}(,\\d{3})+$");

    private NumericValueUtil() {
    }

    /**
     * Canonical local-currency text: the original formatting with currency markers and
     * whitespace removed. Decimal and thousands separators are kept as written.
     */
    public static String localCurrencyText(String raw) {
        if (raw == null) return "";
        String text = DASHES.matcher(raw).replaceAll("-");
        text = CURRENCY_CODES.matcher(text).replaceAll("");
        text = CURRENCY_SYMBOLS.matcher(text).replaceAll("");
        return WHITESPACE.matcher(text).replaceAll("");
    }

    /**
     * Parses an amount. When both ',' and '.' occur the last one is the decimal separator;
     * a lone comma is a decimal separator.
     */
    public static Optional<BigDecimal> parseAmount(String raw) {
        String text = localCurrencyText(raw);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        int lastComma = text.lastIndexOf(',');
        int lastDot = text.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0) {
            if (lastComma > lastDot) {
                text = text.replace(".", "").replace(',', '.');
            } else {
                text = text.replace(",", "");
            }
        } else if (lastComma >= 0) {
            if (text.indexOf(',') != lastComma) {
                text = text.replace(",", "");
            } else {
                text = text.replace(',', '.');
            }
        } else if (lastDot >= 0 && text.indexOf('.') != lastDot) {
            text = text.replace(".", "");
        }
        if (!PLAIN_NUMBER.matcher(text).matches()) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(text));
    }

    /**
     * Parses a quantity. "1,250" reads as one thousand two hundred fifty here,
     * unlike {@link #parseAmount(String)}.
     */
    public static Optional<BigDecimal> parseQuantity(String raw) {
        String text = localCurrencyText(raw);
        if (THOUSANDS_GROUPED.matcher(text).matches()) {
            return Optional.of(new BigDecimal(text.replace(",", "")));
        }
        return parseAmount(text);
    }

    /**
     * Smallest non-negative scale holding the value: 116.00 and 116.0 become 116,
     * 17.90 becomes 17.9. Null stays null.
     */
    public static BigDecimal normalizeScale(BigDecimal value) {
        if (value == null) return null;
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    public static boolean isIntegral(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }

    /**
     * Integer value of a cell such as "3", "3.0" or "2024"; empty for anything non-integral.
     */
    public static Optional<Integer> parseInteger(String raw) {
        Optional<BigDecimal> value = parseQuantity(raw);
        if (value.isEmpty() || !isIntegral(value.get())) {
            return Optional.empty();
        }
        try {
            return Optional.of(value.get().intValueExact());
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
    }
}
