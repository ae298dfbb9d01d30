package com.bmsedge.sellout.profile;

/**
 * Fields a source column can be mapped onto.
 */
public enum CanonicalField {
    PRODUCT_EAN("product_ean"),
    FUNCTIONAL_NAME("functional_name"),
    ALTERNATE_NAME("alternate_name"),
    MONTH("month"),
    YEAR("year"),
    QUANTITY("quantity"),
    SALES_LC("sales_lc"),
    SALES_EUR("sales_eur"),
    CURRENCY("currency"),
    RESELLER("reseller");

    private final String columnName;

    CanonicalField(String columnName) {
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }
}
