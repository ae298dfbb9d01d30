package com.bmsedge.sellout.service;

import com.bmsedge.sellout.dto.CanonicalEntry;
import com.bmsedge.sellout.dto.CleanedRow;
import com.bmsedge.sellout.util.NumericValueUtil;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Projects long-form rows onto the canonical schema.
 */
@Service
public class CanonicalMapper {

    static final String EUR = "EUR";

    public List<CanonicalEntry> map(List<CleanedRow> rows, String uploadId) {
        List<CanonicalEntry> entries = new ArrayList<>(rows.size());
        for (CleanedRow row : rows) {
            entries.add(CanonicalEntry.builder()
                    .uploadId(uploadId)
                    .reseller(row.getReseller())
                    .productEan(row.getProductEan() == null || row.getProductEan().isBlank() ? null : row.getProductEan())
                    .month(row.getMonth())
                    .year(row.getYear())
                    .quantity(row.getQuantity())
                    .salesLc(row.getSalesLc())
                    .salesEur(salesEur(row))
                    .currency(row.getCurrency())
                    .functionalName(row.getFunctionalName() == null ? "" : row.getFunctionalName())
                    .sourceRow(row.getRowIndex())
                    .build());
        }
        return entries;
    }

    // Conversion for other currencies needs a rate source this service does not have.
    private static BigDecimal salesEur(CleanedRow row) {
        if (row.getSalesEur() != null) {
            return NumericValueUtil.normalizeScale(row.getSalesEur());
        }
        return EUR.equals(row.getCurrency()) ? NumericValueUtil.normalizeScale(row.getSalesAmount()) : null;
    }
}
