package com.bmsedge.sellout.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A row after mapping and coercion. Wide rows leave quantity and period empty and carry
 * their values in {@link #periodCells} until the shape normalizer unpivots them.
 */
@Value
@Builder(toBuilder = true)
public class CleanedRow {

    int rowIndex;
    String productEan;
    String functionalName;
    String alternateName;
    Integer month;
    Integer year;
    Integer quantity;

    /** Local-currency amount as written, currency markers and whitespace removed. */
    String salesLc;

    /** Numeric reading of {@link #salesLc}. */
    BigDecimal salesAmount;

    BigDecimal salesEur;
    String currency;
    String reseller;

    @Singular
    List<PeriodCell> periodCells;

    public boolean isWide() {
        return !periodCells.isEmpty();
    }
}
