package com.bmsedge.sellout.service;

import com.bmsedge.sellout.dto.AuditTrail;
import com.bmsedge.sellout.dto.CleanedRow;
import com.bmsedge.sellout.dto.PeriodCell;
import com.bmsedge.sellout.profile.CanonicalField;
import com.bmsedge.sellout.profile.DedupRule;
import com.bmsedge.sellout.profile.MetricType;
import com.bmsedge.sellout.profile.RowFilterRule;
import com.bmsedge.sellout.profile.SourceProfile;
import com.bmsedge.sellout.util.NumericValueUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brings cleaned rows into long form: one observation per row.
 */
@Service
public class ShapeNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(ShapeNormalizer.class);

    static final String TYPE_UNPIVOT = "unpivot";
    static final String PAIR_RECONCILIATION = "pair_reconciliation";

    public List<CleanedRow> normalize(List<CleanedRow> rows, SourceProfile profile, AuditTrail trail) {
        List<CleanedRow> longRows = profile.isWide() ? unpivot(rows, profile, trail) : rows;
        if (profile.getDedupRule() == DedupRule.BOTTOM_OF_PAIR) {
            return reconcilePairs(longRows, profile.getDedupKey(), trail);
        }
        return longRows;
    }

    /**
     * One output row per distinct (year, month) of a wide row. Quantity comes from the
     * period's units cell and the amount from its value cell.
     */
    List<CleanedRow> unpivot(List<CleanedRow> rows, SourceProfile profile, AuditTrail trail) {
        boolean allowZero = profile.hasRule(RowFilterRule.ALLOW_ZERO_QUANTITY_WITH_AMOUNT);
        List<CleanedRow> result = new ArrayList<>();

        for (CleanedRow row : rows) {
            if (!row.isWide()) {
                result.add(row);
                continue;
            }
            Map<YearMonth, PeriodValues> periods = new LinkedHashMap<>();
            for (PeriodCell cell : row.getPeriodCells()) {
                PeriodValues values = periods.computeIfAbsent(YearMonth.of(cell.getYear(), cell.getMonth()),
                        key -> new PeriodValues());
                if (cell.getMetric() == MetricType.SALES_AMOUNT) {
                    if (values.sales == null) values.sales = cell;
                } else if (values.quantity == null) {
                    values.quantity = cell;
                }
            }

            for (Map.Entry<YearMonth, PeriodValues> entry : periods.entrySet()) {
                PeriodValues values = entry.getValue();
                String salesLc = null;
                BigDecimal salesAmount = null;
                if (values.sales != null) {
                    salesLc = NumericValueUtil.localCurrencyText(values.sales.getRawValue());
                    salesAmount = NumericValueUtil.parseAmount(salesLc).orElse(null);
                }
                String rawQuantity = values.quantity == null ? null : values.quantity.getRawValue();
                String column = values.quantity != null ? values.quantity.getHeader() : values.sales.getHeader();

                QuantityRules.Outcome quantity = QuantityRules.evaluate(rawQuantity, salesAmount, allowZero);
                if (!quantity.isAccepted()) {
                    trail.drop(row.getRowIndex(), column, rawQuantity, quantity.getDropReason());
                    continue;
                }
                trail.record(row.getRowIndex(), column, rawQuantity,
                        String.valueOf(quantity.getQuantity()), TYPE_UNPIVOT);

                result.add(row.toBuilder()
                        .clearPeriodCells()
                        .month(entry.getKey().getMonthValue())
                        .year(entry.getKey().getYear())
                        .quantity(quantity.getQuantity())
                        .salesLc(salesLc)
                        .salesAmount(salesAmount)
                        .build());
            }
        }
        logger.info("Unpivoted {} wide rows into {} period rows", rows.size(), result.size());
        return result;
    }

    /**
     * Within each group of exactly two rows sharing the key the later row wins. Groups of
     * any other size pass through untouched and are reported as anomalies.
     */
    List<CleanedRow> reconcilePairs(List<CleanedRow> rows, List<CanonicalField> key, AuditTrail trail) {
        Map<List<Object>, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            groups.computeIfAbsent(keyOf(rows.get(i), key), k -> new ArrayList<>()).add(i);
        }

        Set<Integer> discarded = new HashSet<>();
        for (Map.Entry<List<Object>, List<Integer>> group : groups.entrySet()) {
            List<Integer> members = group.getValue();
            if (members.size() == 2) {
                CleanedRow earlier = rows.get(members.get(0));
                discarded.add(members.get(0));
                trail.drop(earlier.getRowIndex(), null, String.valueOf(group.getKey()), PAIR_RECONCILIATION);
            } else if (members.size() > 2) {
                CleanedRow first = rows.get(members.get(0));
                trail.anomaly(first.getRowIndex(), null,
                        members.size() + " rows share key " + group.getKey());
                logger.warn("Dedup anomaly: {} rows share key {}", members.size(), group.getKey());
            }
        }

        List<CleanedRow> kept = new ArrayList<>(rows.size() - discarded.size());
        for (int i = 0; i < rows.size(); i++) {
            if (!discarded.contains(i)) {
                kept.add(rows.get(i));
            }
        }
        return kept;
    }

    private static List<Object> keyOf(CleanedRow row, List<CanonicalField> key) {
        List<Object> values = new ArrayList<>(key.size());
        for (CanonicalField field : key) {
            values.add(fieldValue(row, field));
        }
        return values;
    }

    private static Object fieldValue(CleanedRow row, CanonicalField field) {
        switch (field) {
            case PRODUCT_EAN:
                return row.getProductEan();
            case FUNCTIONAL_NAME:
                return row.getFunctionalName();
            case ALTERNATE_NAME:
                return row.getAlternateName();
            case MONTH:
                return row.getMonth();
            case YEAR:
                return row.getYear();
            case QUANTITY:
                return row.getQuantity();
            case SALES_LC:
                return row.getSalesLc();
            case SALES_EUR:
                return row.getSalesEur();
            case CURRENCY:
                return row.getCurrency();
            case RESELLER:
                return row.getReseller();
            default:
                throw new IllegalArgumentException("Unsupported dedup field " + field);
        }
    }

    private static class PeriodValues {
        PeriodCell quantity;
        PeriodCell sales;
    }
}
