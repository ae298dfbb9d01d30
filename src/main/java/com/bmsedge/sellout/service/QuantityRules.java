package com.bmsedge.sellout.service;

import com.bmsedge.sellout.util.NumericValueUtil;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Quantity policy shared by flat rows and unpivoted period rows: blank means no data,
 * only integral values survive, zero survives only with a non-zero amount where allowed,
 * negatives always survive as returns.
 */
final class QuantityRules {

    static final String MISSING_QUANTITY = "missing_quantity";
    static final String INVALID_QUANTITY = "invalid_quantity";
    static final String NON_INTEGER_QUANTITY = "non_integer_quantity";
    static final String ZERO_QUANTITY = "zero_quantity";

    private QuantityRules() {
    }

    static Outcome evaluate(String rawQuantity, BigDecimal salesAmount, boolean allowZeroWithAmount) {
        if (rawQuantity == null || rawQuantity.isBlank()) {
            return Outcome.dropped(MISSING_QUANTITY);
        }
        Optional<BigDecimal> parsed = NumericValueUtil.parseQuantity(rawQuantity);
        if (parsed.isEmpty()) {
            return Outcome.dropped(INVALID_QUANTITY);
        }
        BigDecimal value = parsed.get();
        if (!NumericValueUtil.isIntegral(value)) {
            return Outcome.dropped(NON_INTEGER_QUANTITY);
        }
        int quantity;
        try {
            quantity = value.intValueExact();
        } catch (ArithmeticException e) {
            return Outcome.dropped(INVALID_QUANTITY);
        }
        if (quantity == 0) {
            boolean hasAmount = salesAmount != null && salesAmount.signum() != 0;
            if (!allowZeroWithAmount || !hasAmount) {
                return Outcome.dropped(ZERO_QUANTITY);
            }
        }
        return Outcome.accepted(quantity);
    }

    @Value
    static class Outcome {
        Integer quantity;
        String dropReason;

        static Outcome accepted(int quantity) {
            return new Outcome(quantity, null);
        }

        static Outcome dropped(String reason) {
            return new Outcome(null, reason);
        }

        boolean isAccepted() {
            return quantity != null;
        }
    }
}
