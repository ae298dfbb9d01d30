package com.bmsedge.sellout.dto;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A sales observation in the fixed output schema.
 */
@Value
@Builder(toBuilder = true)
public class CanonicalEntry {

    String uploadId;
    String reseller;
    String productEan;
    Integer month;
    Integer year;
    Integer quantity;
    String salesLc;
    BigDecimal salesEur;
    String currency;
    String functionalName;

    /** Row of the source sheet, for audit records only. Never persisted. */
    @EqualsAndHashCode.Exclude
    Integer sourceRow;
}
