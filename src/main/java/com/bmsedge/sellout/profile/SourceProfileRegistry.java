package com.bmsedge.sellout.profile;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.bmsedge.sellout.profile.CanonicalField.*;

/**
 * Catalog of known reseller formats. Registration order is detection order, so more
 * specific patterns are registered before looser ones.
 */
@Component
public class SourceProfileRegistry {

    public static final String FALLBACK_ID = "generic";

    private final Map<String, SourceProfile> profiles = new LinkedHashMap<>();
    private final SourceProfile fallback;

    public SourceProfileRegistry() {
        register(SourceProfile.builder()
                .sourceId("galilu")
                .resellerLabel("Galilu")
                .filenamePattern("galilu")
                .column(FUNCTIONAL_NAME, ColumnRef.at(0))
                .pivotShape(PivotShape.builder()
                        .defaultMetric(MetricType.QUANTITY)
                        .stopAtTotalColumn(true)
                        .yearFromCornerCell(true)
                        .build())
                .dateStrategy(DateStrategy.PER_COLUMN)
                .filenameDateFallback(DateStrategy.FILENAME_YEAR)
                .defaultCurrency("PLN")
                .rowFilter(RowFilterRule.SKIP_TOTAL_ROWS)
                .rowFilter(RowFilterRule.REQUIRE_FUNCTIONAL_NAME)
                .build());

        register(SourceProfile.builder()
                .sourceId("boxnox")
                .resellerLabel("Boxnox")
                .filenamePattern("boxnox")
                .sheetNamePattern("sell out by ean")
                .sheetSelection(SheetSelectionRule.preferNameContaining("sell out by ean"))
                .column(PRODUCT_EAN, ColumnRef.named("EAN"))
                .column(QUANTITY, ColumnRef.named("QTY", "Quantity"))
                .column(SALES_LC, ColumnRef.named("AMOUNT"))
                .column(FUNCTIONAL_NAME, ColumnRef.named("SKU"))
                .column(MONTH, ColumnRef.named("MONTH"))
                .column(YEAR, ColumnRef.named("YEAR"))
                .dateStrategy(DateStrategy.ROW_COLUMNS)
                .filenameDateFallback(DateStrategy.MONTH_TOKEN_YEAR)
                .defaultCurrency("EUR")
                .padEanTo13(true)
                .nameCase(NameCase.UPPER)
                .rowFilter(RowFilterRule.ALLOW_ZERO_QUANTITY_WITH_AMOUNT)
                .build());

        register(SourceProfile.builder()
                .sourceId("skins_sa")
                .resellerLabel("Skins SA")
                .filenamePattern("skins sa")
                .sheetNamePattern("bibbi")
                .column(PRODUCT_EAN, ColumnRef.named("StockCode"))
                .column(QUANTITY, ColumnRef.named("OrderQty"))
                .column(SALES_LC, ColumnRef.named("ExVatNetsales"))
                .column(MONTH, ColumnRef.named("MONTH"))
                .column(YEAR, ColumnRef.named("YEAR"))
                .dateStrategy(DateStrategy.YEAR_AND_MONTH_NAME)
                .defaultCurrency("ZAR")
                .padEanTo13(true)
                .rowFilter(RowFilterRule.REQUIRE_PRODUCT_EAN)
                .rowFilter(RowFilterRule.MATCH_FILE_PERIOD)
                .rowFilter(RowFilterRule.ALLOW_ZERO_QUANTITY_WITH_AMOUNT)
                .build());

        register(SourceProfile.builder()
                .sourceId("skins_nl")
                .resellerLabel("Skins NL")
                .filenamePattern("bibbiparfu")
                .sheetNamePattern("salespersku")
                .sheetSelection(SheetSelectionRule.preferNameContaining("salespersku"))
                .column(PRODUCT_EAN, ColumnRef.named("EANCode", "EAN", "EAN Code"))
                .column(QUANTITY, ColumnRef.named("SalesQuantity", "Quantity", "Qty"))
                .column(SALES_LC, ColumnRef.named("SalesAmount", "Amount"))
                .dateStrategy(DateStrategy.REPORT_PERIOD)
                .defaultCurrency("EUR")
                .build());

        register(SourceProfile.builder()
                .sourceId("cdlc")
                .resellerLabel("Creme de la Creme")
                .filenamePattern("cdlc")
                .filenamePattern("bibbi sell out")
                .sheetNamePattern("bibbi")
                .sheetNameSignature(Pattern.compile("^\\d{4}\\s+\\d{2}$"))
                .headerRow(3)
                .column(PRODUCT_EAN, ColumnRef.at(1))
                .column(FUNCTIONAL_NAME, ColumnRef.at(2))
                .column(QUANTITY, ColumnRef.at(13))
                .column(SALES_LC, ColumnRef.at(14))
                .dateStrategy(DateStrategy.YEAR_MONTH_DIGITS)
                .defaultCurrency("EUR")
                .rowFilter(RowFilterRule.REQUIRE_EAN13)
                .rowFilter(RowFilterRule.ALLOW_ZERO_QUANTITY_WITH_AMOUNT)
                .build());

        register(SourceProfile.builder()
                .sourceId("liberty")
                .resellerLabel("Liberty")
                .filenamePattern("continuity")
                .filenamePattern("liberty")
                .column(ALTERNATE_NAME, ColumnRef.at(4))
                .column(FUNCTIONAL_NAME, ColumnRef.at(5))
                .column(QUANTITY, ColumnRef.at(20))
                .column(SALES_LC, ColumnRef.at(21))
                .dateStrategy(DateStrategy.WEEKLY_MINUS_ONE_WEEK)
                .defaultCurrency("GBP")
                .rowFilter(RowFilterRule.SKIP_TOTAL_ROWS)
                .rowFilter(RowFilterRule.REQUIRE_SALES_AMOUNT)
                .rowFilter(RowFilterRule.ALLOW_ZERO_QUANTITY_WITH_AMOUNT)
                .fillNameFromNeighbours(true)
                .dedupRule(DedupRule.BOTTOM_OF_PAIR)
                .dedupKey(List.of(FUNCTIONAL_NAME, QUANTITY, SALES_LC))
                .build());

        register(SourceProfile.builder()
                .sourceId("aromateque")
                .resellerLabel("Aromateque")
                .filenamePattern("aromateque")
                .filenamePattern("bibbi sales")
                .headerRow(10)
                .column(FUNCTIONAL_NAME, ColumnRef.at(1))
                .nameCase(NameCase.UPPER)
                .pivotShape(PivotShape.builder()
                        .defaultMetric(MetricType.QUANTITY)
                        .stopAtTotalColumn(true)
                        .build())
                .dateStrategy(DateStrategy.PER_COLUMN)
                .filenameDateFallback(DateStrategy.MONTH_APOSTROPHE_YEAR)
                .defaultCurrency("EUR")
                .rowFilter(RowFilterRule.SKIP_TOTAL_ROWS)
                .rowFilter(RowFilterRule.REQUIRE_FUNCTIONAL_NAME)
                .build());

        register(SourceProfile.builder()
                .sourceId("ukraine")
                .resellerLabel("Ukraine")
                .filenamePattern("ukraine")
                .sheetNamePattern("tdsheet")
                .sheetSelection(SheetSelectionRule.preferNameContaining("tdsheet"))
                .headerRow(0)
                .twoRowHeader(true)
                .column(FUNCTIONAL_NAME, ColumnRef.named("Product", "Товар", "Номенклатура", "Item"))
                .pivotShape(PivotShape.builder()
                        .defaultMetric(MetricType.QUANTITY)
                        .stopAtTotalColumn(false)
                        .build())
                .dateStrategy(DateStrategy.PER_COLUMN)
                .filenameDateFallback(DateStrategy.FILENAME_YEAR)
                .defaultCurrency("UAH")
                .rowFilter(RowFilterRule.SKIP_TOTAL_ROWS)
                .rowFilter(RowFilterRule.REQUIRE_FUNCTIONAL_NAME)
                .rowFilter(RowFilterRule.ALLOW_ZERO_QUANTITY_WITH_AMOUNT)
                .build());

        fallback = SourceProfile.builder()
                .sourceId(FALLBACK_ID)
                .resellerLabel("Unknown")
                .guessHeaderRow(true)
                .column(PRODUCT_EAN, ColumnRef.named("Product EAN", "EAN", "EAN Code", "Barcode"))
                .column(FUNCTIONAL_NAME, ColumnRef.named("Functional Name", "Product Name", "Name"))
                .column(MONTH, ColumnRef.named("Month"))
                .column(YEAR, ColumnRef.named("Year"))
                .column(QUANTITY, ColumnRef.named("Quantity", "Qty", "Units"))
                .column(SALES_LC, ColumnRef.named("Sales LC", "Sales", "Amount"))
                .column(SALES_EUR, ColumnRef.named("Sales EUR"))
                .column(CURRENCY, ColumnRef.named("Currency"))
                .column(RESELLER, ColumnRef.named("Reseller"))
                .dateStrategy(DateStrategy.ROW_COLUMNS)
                .defaultCurrency("USD")
                .rowFilter(RowFilterRule.ALLOW_ZERO_QUANTITY_WITH_AMOUNT)
                .build();
        profiles.put(FALLBACK_ID, fallback);
    }

    private void register(SourceProfile profile) {
        profiles.put(profile.getSourceId(), profile);
    }

    /**
     * Profiles in detection order, fallback last.
     */
    public List<SourceProfile> all() {
        return Collections.unmodifiableList(new ArrayList<>(profiles.values()));
    }

    public Optional<SourceProfile> find(String sourceId) {
        return Optional.ofNullable(profiles.get(sourceId));
    }

    public SourceProfile fallback() {
        return fallback;
    }
}
