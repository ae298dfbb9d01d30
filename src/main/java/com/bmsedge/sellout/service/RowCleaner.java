package com.bmsedge.sellout.service;

import com.bmsedge.sellout.dto.AuditTrail;
import com.bmsedge.sellout.dto.CleanedRow;
import com.bmsedge.sellout.dto.PeriodCell;
import com.bmsedge.sellout.dto.RawRow;
import com.bmsedge.sellout.dto.SheetTable;
import com.bmsedge.sellout.exception.DateDerivationException;
import com.bmsedge.sellout.profile.CanonicalField;
import com.bmsedge.sellout.profile.ColumnRef;
import com.bmsedge.sellout.profile.DateStrategy;
import com.bmsedge.sellout.profile.MetricType;
import com.bmsedge.sellout.profile.NameCase;
import com.bmsedge.sellout.profile.PivotShape;
import com.bmsedge.sellout.profile.RowFilterRule;
import com.bmsedge.sellout.profile.SourceProfile;
import com.bmsedge.sellout.util.MonthNameUtil;
import com.bmsedge.sellout.util.NumericValueUtil;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies a profile's column mapping, date derivation, numeric coercion and row filters.
 * Row-level problems drop the row into the audit trail; only a missing report period
 * fails the file.
 */
@Service
public class RowCleaner {

    private static final Logger logger = LoggerFactory.getLogger(RowCleaner.class);

    static final String TYPE_EAN = "ean_normalization";
    static final String TYPE_NAME_CASE = "name_case";
    static final String TYPE_NAME_FILL = "name_fill";
    static final String TYPE_CURRENCY_CLEANING = "currency_cleaning";
    static final String TYPE_QUANTITY = "quantity_coercion";
    static final String TYPE_FILENAME_DATE = "filename_date_extraction";
    static final String TYPE_FILENAME_DATE_FALLBACK = "filename_date_fallback";
    static final String TYPE_HEADER_YEAR = "header_year_extraction";

    static final int MAX_YEAR = 9999;

    private static final Set<String> TOTAL_LABELS = Set.of("total", "grand total", "subtotal", "sum", "итого", "разом", "всього");
    private static final Pattern EAN_DECIMAL_SUFFIX = Pattern.compile("^(\\d+)\\.0+$");
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");
    private static final Pattern EAN13 = Pattern.compile("^\\d{13}$");
    private static final Pattern YEAR_IN_TEXT = Pattern.compile("(?<!\\d)(\\d{4})(?!\\d)");
    private static final Pattern CURRENCY_CODE = Pattern.compile("^[A-Za-z]{3}$");

    public List<CleanedRow> clean(SheetTable table, SourceProfile profile, String filename, AuditTrail trail) {
        Map<CanonicalField, Integer> columns = resolveColumns(table, profile);
        List<RawRow> rows = table.getRows();
        YearMonth filePeriod = deriveFilePeriod(table, profile, filename, trail);
        YearMonth fallbackPeriod = null;
        if (filePeriod == null && profile.getFilenameDateFallback() != null && !profile.isWide()) {
            fallbackPeriod = profile.getFilenameDateFallback().derive(filename, table.getPreamble()).orElse(null);
        }
        if (!profile.isWide() && filePeriod == null && fallbackPeriod == null
                && (!columns.containsKey(CanonicalField.MONTH) || !columns.containsKey(CanonicalField.YEAR))) {
            throw new DateDerivationException("No month/year columns in sheet '" + table.getSheetName()
                    + "' and no period in filename '" + filename + "'");
        }

        List<PeriodColumn> periodColumns = profile.isWide()
                ? resolvePeriodColumns(table, profile, filename, columns, trail)
                : List.of();
        Map<Integer, String> filledNames = profile.isFillNameFromNeighbours()
                ? fillNamesFromNeighbours(rows, columns, trail)
                : Map.of();

        List<CleanedRow> cleaned = new ArrayList<>();
        for (RawRow raw : rows) {
            CleanedRow row = cleanRow(raw, profile, columns, filePeriod, fallbackPeriod, periodColumns, filledNames, trail);
            if (row != null) {
                cleaned.add(row);
            }
        }
        logger.info("Cleaned {} of {} rows for source '{}' ({} skipped)",
                cleaned.size(), rows.size(), profile.getSourceId(), trail.getRowsSkipped());
        return cleaned;
    }

    private CleanedRow cleanRow(RawRow raw, SourceProfile profile, Map<CanonicalField, Integer> columns,
                                YearMonth filePeriod, YearMonth fallbackPeriod, List<PeriodColumn> periodColumns,
                                Map<Integer, String> filledNames, AuditTrail trail) {
        int rowIndex = raw.getRowNumber();

        if (profile.hasRule(RowFilterRule.SKIP_TOTAL_ROWS) && isTotalRow(raw)) {
            trail.drop(rowIndex, null, null, "total_row");
            return null;
        }

        String ean = normalizeEan(cell(raw, columns, CanonicalField.PRODUCT_EAN), profile, rowIndex, trail);
        if (profile.hasRule(RowFilterRule.REQUIRE_PRODUCT_EAN) && ean.isEmpty()) {
            trail.drop(rowIndex, CanonicalField.PRODUCT_EAN.getColumnName(), ean, "missing_product_ean");
            return null;
        }
        if (profile.hasRule(RowFilterRule.REQUIRE_EAN13) && !EAN13.matcher(ean).matches()) {
            trail.drop(rowIndex, CanonicalField.PRODUCT_EAN.getColumnName(), ean, "invalid_ean");
            return null;
        }

        String name = filledNames.getOrDefault(rowIndex, cell(raw, columns, CanonicalField.FUNCTIONAL_NAME).trim());
        name = applyNameCase(name, profile.getNameCase(), rowIndex, trail);
        if (profile.hasRule(RowFilterRule.REQUIRE_FUNCTIONAL_NAME) && name.isEmpty()) {
            trail.drop(rowIndex, CanonicalField.FUNCTIONAL_NAME.getColumnName(), name, "missing_functional_name");
            return null;
        }

        CleanedRow.CleanedRowBuilder builder = CleanedRow.builder()
                .rowIndex(rowIndex)
                .productEan(ean)
                .functionalName(name)
                .alternateName(blankToNull(cell(raw, columns, CanonicalField.ALTERNATE_NAME)))
                .currency(resolveCurrency(raw, columns, profile))
                .reseller(resolveReseller(raw, columns, profile));

        if (profile.isWide()) {
            int withValues = 0;
            for (PeriodColumn column : periodColumns) {
                String value = raw.cell(column.getIndex()).trim();
                if (!value.isEmpty()) {
                    builder.periodCell(new PeriodCell(column.getIndex(), column.getHeader(),
                            column.getMonth(), column.getYear(), column.getMetric(), value));
                    withValues++;
                }
            }
            if (withValues == 0) {
                trail.drop(rowIndex, null, null, "no_period_values");
                return null;
            }
            return builder.build();
        }

        YearMonth period = rowPeriod(raw, profile, columns, filePeriod, fallbackPeriod, trail);
        if (period == null) {
            return null;
        }
        builder.month(period.getMonthValue()).year(period.getYear());

        String rawSales = cell(raw, columns, CanonicalField.SALES_LC).trim();
        String salesLc = null;
        BigDecimal salesAmount = null;
        if (!rawSales.isEmpty()) {
            salesLc = NumericValueUtil.localCurrencyText(rawSales);
            if (!salesLc.equals(rawSales)) {
                trail.record(rowIndex, CanonicalField.SALES_LC.getColumnName(), rawSales, salesLc, TYPE_CURRENCY_CLEANING);
            }
            salesAmount = NumericValueUtil.parseAmount(salesLc).orElse(null);
        }
        if (profile.hasRule(RowFilterRule.REQUIRE_SALES_AMOUNT) && salesLc == null) {
            trail.drop(rowIndex, CanonicalField.SALES_LC.getColumnName(), rawSales, "missing_sales_amount");
            return null;
        }

        String rawQuantity = cell(raw, columns, CanonicalField.QUANTITY).trim();
        QuantityRules.Outcome quantity = QuantityRules.evaluate(rawQuantity, salesAmount,
                profile.hasRule(RowFilterRule.ALLOW_ZERO_QUANTITY_WITH_AMOUNT));
        if (!quantity.isAccepted()) {
            trail.drop(rowIndex, CanonicalField.QUANTITY.getColumnName(), rawQuantity, quantity.getDropReason());
            return null;
        }
        if (!rawQuantity.equals(String.valueOf(quantity.getQuantity()))) {
            trail.record(rowIndex, CanonicalField.QUANTITY.getColumnName(), rawQuantity,
                    String.valueOf(quantity.getQuantity()), TYPE_QUANTITY);
        }

        String rawEur = cell(raw, columns, CanonicalField.SALES_EUR);
        return builder
                .quantity(quantity.getQuantity())
                .salesLc(salesLc)
                .salesAmount(salesAmount)
                .salesEur(NumericValueUtil.parseAmount(rawEur).orElse(null))
                .build();
    }

    private YearMonth deriveFilePeriod(SheetTable table, SourceProfile profile, String filename, AuditTrail trail) {
        DateStrategy strategy = profile.getDateStrategy();
        if (!strategy.isFileLevel()) {
            return null;
        }
        Optional<YearMonth> period = strategy.derive(filename, table.getPreamble());
        if (period.isEmpty() && profile.getFilenameDateFallback() != null) {
            period = profile.getFilenameDateFallback().derive(filename, table.getPreamble());
        }
        if (period.isEmpty()) {
            throw new DateDerivationException("Could not derive report month from filename '" + filename
                    + "' for source '" + profile.getSourceId() + "'");
        }
        YearMonth derived = period.get();
        trail.record(0, "report_month", filename, String.valueOf(derived.getMonthValue()), TYPE_FILENAME_DATE);
        trail.record(0, "report_year", filename, String.valueOf(derived.getYear()), TYPE_FILENAME_DATE);
        logger.info("Report period {} derived from '{}' via {}", derived, filename, strategy);
        return derived;
    }

    private YearMonth rowPeriod(RawRow raw, SourceProfile profile, Map<CanonicalField, Integer> columns,
                                YearMonth filePeriod, YearMonth fallbackPeriod, AuditTrail trail) {
        int rowIndex = raw.getRowNumber();
        String monthText = cell(raw, columns, CanonicalField.MONTH).trim();
        String yearText = cell(raw, columns, CanonicalField.YEAR).trim();
        Integer month = parseMonth(monthText);
        Integer year = NumericValueUtil.parseInteger(yearText).orElse(null);

        if (filePeriod != null) {
            if (profile.hasRule(RowFilterRule.MATCH_FILE_PERIOD)
                    && (month == null || year == null
                    || month != filePeriod.getMonthValue() || year != filePeriod.getYear())) {
                trail.drop(rowIndex, CanonicalField.MONTH.getColumnName(), monthText + "/" + yearText, "period_mismatch");
                return null;
            }
            return filePeriod;
        }

        if (month != null && year != null && month >= 1 && month <= 12
                && year >= DateStrategy.MIN_YEAR && year <= MAX_YEAR) {
            return YearMonth.of(year, month);
        }
        // Only a row without any period takes the filename period.
        if (!monthText.isEmpty() || !yearText.isEmpty()) {
            trail.drop(rowIndex, CanonicalField.MONTH.getColumnName(), monthText + "/" + yearText, "invalid_period");
            return null;
        }
        if (fallbackPeriod != null) {
            trail.record(rowIndex, CanonicalField.MONTH.getColumnName(), monthText + "/" + yearText,
                    fallbackPeriod.toString(), TYPE_FILENAME_DATE_FALLBACK);
            return fallbackPeriod;
        }
        trail.drop(rowIndex, CanonicalField.MONTH.getColumnName(), monthText + "/" + yearText, "missing_period");
        return null;
    }

    private static Integer parseMonth(String text) {
        Optional<Integer> numeric = NumericValueUtil.parseInteger(text);
        if (numeric.isPresent()) {
            return numeric.get();
        }
        return MonthNameUtil.parseMonthLabel(text).map(MonthNameUtil.PeriodLabel::getMonth).orElse(null);
    }

    private List<PeriodColumn> resolvePeriodColumns(SheetTable table, SourceProfile profile, String filename,
                                                    Map<CanonicalField, Integer> columns, AuditTrail trail) {
        PivotShape shape = profile.getPivotShape();
        List<String> headers = table.getHeaders();
        Collection<Integer> mapped = columns.values();
        Integer fileYear = null;
        boolean fileYearResolved = false;

        List<PeriodColumn> periodColumns = new ArrayList<>();
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i) == null ? "" : headers.get(i).trim();
            if (header.isEmpty() || mapped.contains(i)) {
                continue;
            }
            String section = null;
            String label = header;
            int separator = header.indexOf(SheetLoader.SECTION_SEPARATOR);
            if (separator >= 0) {
                section = header.substring(0, separator);
                label = header.substring(separator + SheetLoader.SECTION_SEPARATOR.length());
            }
            if (isTotalLabel(label) || (section == null && isTotalLabel(header))) {
                if (shape.isStopAtTotalColumn()) {
                    break;
                }
                continue;
            }

            Optional<MonthNameUtil.PeriodLabel> periodLabel = MonthNameUtil.parseMonthLabel(label);
            if (periodLabel.isEmpty()) {
                continue;
            }
            Integer year = periodLabel.get().getYear();
            if (year == null) {
                if (!fileYearResolved) {
                    fileYear = deriveFileYear(table, profile, filename, trail);
                    fileYearResolved = true;
                }
                year = fileYear;
            }
            if (year == null || year < DateStrategy.MIN_YEAR) {
                throw new DateDerivationException("No valid year for period column '" + header
                        + "' in '" + filename + "'");
            }
            MetricType metric = MetricType.fromSectionLabel(section).orElse(shape.getDefaultMetric());
            periodColumns.add(new PeriodColumn(i, header, periodLabel.get().getMonth(), year, metric));
        }

        if (periodColumns.isEmpty()) {
            throw new DateDerivationException("No month columns found in sheet '" + table.getSheetName()
                    + "' of '" + filename + "'");
        }
        logger.info("Found {} period columns for source '{}'", periodColumns.size(), profile.getSourceId());
        return periodColumns;
    }

    private Integer deriveFileYear(SheetTable table, SourceProfile profile, String filename, AuditTrail trail) {
        if (profile.getPivotShape().isYearFromCornerCell() && !table.getHeaders().isEmpty()) {
            String corner = table.getHeaders().get(0);
            Matcher matcher = YEAR_IN_TEXT.matcher(corner == null ? "" : corner);
            if (matcher.find()) {
                int year = Integer.parseInt(matcher.group(1));
                trail.record(0, "report_year", corner, String.valueOf(year), TYPE_HEADER_YEAR);
                return year;
            }
        }
        if (profile.getFilenameDateFallback() != null) {
            Optional<Integer> year = profile.getFilenameDateFallback().deriveYear(filename, table.getPreamble());
            if (year.isPresent()) {
                trail.record(0, "report_year", filename, String.valueOf(year.get()), TYPE_FILENAME_DATE);
                return year.get();
            }
        }
        return null;
    }

    /**
     * Rows with a blank name take it from the next row when that row repeats the same
     * quantity and amount, otherwise from the previous row, otherwise from the alternate column.
     */
    private Map<Integer, String> fillNamesFromNeighbours(List<RawRow> rows, Map<CanonicalField, Integer> columns,
                                                         AuditTrail trail) {
        Map<Integer, String> filled = new HashMap<>();
        for (int j = 0; j < rows.size(); j++) {
            RawRow row = rows.get(j);
            if (!cell(row, columns, CanonicalField.FUNCTIONAL_NAME).isBlank()) {
                continue;
            }
            String name = null;
            String source = null;
            if (j + 1 < rows.size()) {
                RawRow next = rows.get(j + 1);
                String nextName = cell(next, columns, CanonicalField.FUNCTIONAL_NAME).trim();
                if (!nextName.isEmpty()
                        && cell(next, columns, CanonicalField.QUANTITY).equals(cell(row, columns, CanonicalField.QUANTITY))
                        && cell(next, columns, CanonicalField.SALES_LC).equals(cell(row, columns, CanonicalField.SALES_LC))) {
                    name = nextName;
                    source = "next_row";
                }
            }
            if (name == null && j > 0) {
                String previousName = cell(rows.get(j - 1), columns, CanonicalField.FUNCTIONAL_NAME).trim();
                if (!previousName.isEmpty()) {
                    name = previousName;
                    source = "previous_row";
                }
            }
            if (name == null) {
                String alternate = cell(row, columns, CanonicalField.ALTERNATE_NAME).trim();
                if (!alternate.isEmpty()) {
                    name = alternate;
                    source = "alternate_column";
                }
            }
            if (name != null) {
                filled.put(row.getRowNumber(), name);
                trail.record(row.getRowNumber(), CanonicalField.FUNCTIONAL_NAME.getColumnName(), source, name, TYPE_NAME_FILL);
            }
        }
        return filled;
    }

    private String normalizeEan(String rawEan, SourceProfile profile, int rowIndex, AuditTrail trail) {
        String original = rawEan == null ? "" : rawEan;
        String ean = original.trim();
        Matcher decimal = EAN_DECIMAL_SUFFIX.matcher(ean);
        if (decimal.matches()) {
            ean = decimal.group(1);
        }
        if (profile.isPadEanTo13() && DIGITS.matcher(ean).matches() && ean.length() < 13) {
            ean = "0".repeat(13 - ean.length()) + ean;
        }
        if (!ean.equals(original)) {
            trail.record(rowIndex, CanonicalField.PRODUCT_EAN.getColumnName(), original, ean, TYPE_EAN);
        }
        return ean;
    }

    private String applyNameCase(String name, NameCase nameCase, int rowIndex, AuditTrail trail) {
        if (nameCase != NameCase.UPPER || name.isEmpty()) {
            return name;
        }
        String upper = name.toUpperCase(Locale.ROOT);
        if (!upper.equals(name)) {
            trail.record(rowIndex, CanonicalField.FUNCTIONAL_NAME.getColumnName(), name, upper, TYPE_NAME_CASE);
        }
        return upper;
    }

    private String resolveCurrency(RawRow raw, Map<CanonicalField, Integer> columns, SourceProfile profile) {
        String value = cell(raw, columns, CanonicalField.CURRENCY).trim();
        if (CURRENCY_CODE.matcher(value).matches()) {
            return value.toUpperCase(Locale.ROOT);
        }
        return profile.getDefaultCurrency();
    }

    private String resolveReseller(RawRow raw, Map<CanonicalField, Integer> columns, SourceProfile profile) {
        String value = cell(raw, columns, CanonicalField.RESELLER).trim();
        return value.isEmpty() ? profile.getResellerLabel() : value;
    }

    static Map<CanonicalField, Integer> resolveColumns(SheetTable table, SourceProfile profile) {
        Map<CanonicalField, Integer> resolved = new EnumMap<>(CanonicalField.class);
        int width = table.width();
        for (Map.Entry<CanonicalField, ColumnRef> entry : profile.getColumns().entrySet()) {
            int index = entry.getValue().resolve(table.getHeaders(), width);
            if (index >= 0) {
                resolved.put(entry.getKey(), index);
            }
        }
        return resolved;
    }

    private static boolean isTotalRow(RawRow raw) {
        for (String cell : raw.getCells()) {
            if (cell != null && isTotalLabel(cell)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isTotalLabel(String text) {
        String lower = text.trim().toLowerCase(Locale.ROOT);
        return TOTAL_LABELS.contains(lower) || lower.startsWith("total ") || lower.startsWith("grand total");
    }

    private static String cell(RawRow raw, Map<CanonicalField, Integer> columns, CanonicalField field) {
        Integer index = columns.get(field);
        return index == null ? "" : raw.cell(index);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Value
    static class PeriodColumn {
        int index;
        String header;
        int month;
        int year;
        MetricType metric;
    }
}
