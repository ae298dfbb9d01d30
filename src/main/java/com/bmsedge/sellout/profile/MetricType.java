package com.bmsedge.sellout.profile;

import java.util.Locale;
import java.util.Optional;

/**
 * What an unpivoted period cell feeds.
 */
public enum MetricType {
    QUANTITY,
    SALES_AMOUNT;

    public static Optional<MetricType> fromSectionLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String lower = label.toLowerCase(Locale.ROOT);
        if (lower.contains("value") || lower.contains("amount") || lower.contains("sales")
                || lower.contains("сума") || lower.contains("сумма")) {
            return Optional.of(SALES_AMOUNT);
        }
        if (lower.contains("unit") || lower.contains("quantity") || lower.contains("qty")
                || lower.contains("кількість") || lower.contains("количество")) {
            return Optional.of(QUANTITY);
        }
        return Optional.empty();
    }
}
