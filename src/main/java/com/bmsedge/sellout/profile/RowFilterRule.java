package com.bmsedge.sellout.profile;

/**
 * Per-source row predicates. Blank quantities are always dropped and negatives always kept,
 * so those two are not listed here.
 */
public enum RowFilterRule {
    SKIP_TOTAL_ROWS,
    REQUIRE_PRODUCT_EAN,
    REQUIRE_EAN13,
    REQUIRE_FUNCTIONAL_NAME,
    REQUIRE_SALES_AMOUNT,
    /** MONTH/YEAR columns must equal the period derived from the filename. */
    MATCH_FILE_PERIOD,
    ALLOW_ZERO_QUANTITY_WITH_AMOUNT
}
