package com.bmsedge.sellout.util;

import com.bmsedge.sellout.dto.CanonicalEntry;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts canonical entries into maps holding only String, Integer, Long, Double, Boolean
 * or null, the shape the storage boundary accepts.
 */
public class WireRecordConverter {

    public static final String UPLOAD_ID = "upload_id";
    public static final String RESELLER = "reseller";
    public static final String PRODUCT_EAN = "product_ean";
    public static final String MONTH = "month";
    public static final String YEAR = "year";
    public static final String QUANTITY = "quantity";
    public static final String SALES_LC = "sales_lc";
    public static final String SALES_EUR = "sales_eur";
    public static final String CURRENCY = "currency";
    public static final String FUNCTIONAL_NAME = "functional_name";
    public static final String CREATED_AT = "created_at";

    private WireRecordConverter() {
    }

    public static Map<String, Object> toWireRecord(CanonicalEntry entry, Instant createdAt) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(UPLOAD_ID, entry.getUploadId());
        record.put(RESELLER, entry.getReseller());
        record.put(PRODUCT_EAN, entry.getProductEan());
        record.put(MONTH, entry.getMonth());
        record.put(YEAR, entry.getYear());
        record.put(QUANTITY, entry.getQuantity());
        record.put(SALES_LC, entry.getSalesLc());
        record.put(SALES_EUR, entry.getSalesEur() == null ? null : entry.getSalesEur().doubleValue());
        record.put(CURRENCY, entry.getCurrency());
        record.put(FUNCTIONAL_NAME, entry.getFunctionalName());
        record.put(CREATED_AT, createdAt == null ? null : createdAt.toString());
        return record;
    }

    public static CanonicalEntry fromWireRecord(Map<String, Object> record) {
        Object salesEur = record.get(SALES_EUR);
        return CanonicalEntry.builder()
                .uploadId((String) record.get(UPLOAD_ID))
                .reseller((String) record.get(RESELLER))
                .productEan((String) record.get(PRODUCT_EAN))
                .month(toInteger(record.get(MONTH)))
                .year(toInteger(record.get(YEAR)))
                .quantity(toInteger(record.get(QUANTITY)))
                .salesLc((String) record.get(SALES_LC))
                .salesEur(toDecimal(salesEur))
                .currency((String) record.get(CURRENCY))
                .functionalName((String) record.get(FUNCTIONAL_NAME))
                .build();
    }

    /**
     * The record's creation time, or null when the record carries none.
     */
    public static Instant createdAt(Map<String, Object> record) {
        Object value = record.get(CREATED_AT);
        return value == null ? null : Instant.parse(value.toString());
    }

    // Doubles decode at their shortest scale so 116 round-trips as 116, not 116.0.
    private static BigDecimal toDecimal(Object value) {
        if (value == null) return null;
        BigDecimal decimal = value instanceof Number
                ? BigDecimal.valueOf(((Number) value).doubleValue())
                : new BigDecimal(value.toString());
        return NumericValueUtil.normalizeScale(decimal);
    }

    private static Integer toInteger(Object value) {
        if (value == null) return null;
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.valueOf(value.toString());
    }
}
