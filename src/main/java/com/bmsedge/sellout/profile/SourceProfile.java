package com.bmsedge.sellout.profile;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parsing rules for one reseller's export. Profiles are plain data; a single cleaning
 * routine interprets them.
 */
@Value
@Builder
public class SourceProfile {

    String sourceId;
    String resellerLabel;

    /** Lower-case, whitespace-normalized substrings matched against the filename. */
    @Singular
    List<String> filenamePatterns;

    @Singular
    List<String> sheetNamePatterns;

    /** When set, a sheet pattern only counts if some sheet name also matches this in full. */
    Pattern sheetNameSignature;

    /** Zero-based row holding the headers. */
    int headerRow;

    /** Section labels on {@link #headerRow}, month labels on the row below. */
    boolean twoRowHeader;

    /** Scan the first rows for the best header candidate instead of trusting {@link #headerRow}. */
    boolean guessHeaderRow;

    @Builder.Default
    SheetSelectionRule sheetSelection = SheetSelectionRule.firstSheet();

    @Singular
    Map<CanonicalField, ColumnRef> columns;

    DateStrategy dateStrategy;

    /** Consulted when {@link #dateStrategy} finds nothing; may be null. */
    DateStrategy filenameDateFallback;

    String defaultCurrency;

    @Singular
    Set<RowFilterRule> rowFilters;

    @Builder.Default
    DedupRule dedupRule = DedupRule.NONE;

    @Builder.Default
    List<CanonicalField> dedupKey = List.of();

    /** Non-null for wide sources. */
    PivotShape pivotShape;

    boolean padEanTo13;

    @Builder.Default
    NameCase nameCase = NameCase.PRESERVE;

    /** Blank names are taken from the adjacent row describing the same sale. */
    boolean fillNameFromNeighbours;

    public boolean isWide() {
        return pivotShape != null;
    }

    public boolean hasRule(RowFilterRule rule) {
        return rowFilters.contains(rule);
    }

    public ColumnRef column(CanonicalField field) {
        return columns.get(field);
    }
}
