package com.bmsedge.sellout.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SheetTable {

    String sheetName;

    @Builder.Default
    List<String> sheetNames = List.of();

    /** Header texts; for two-row headers "section | label", or just the label. */
    @Singular
    List<String> headers;

    /** Rows above the header row, kept for strategies that read report cells. */
    @Singular("preambleRow")
    List<List<String>> preamble;

    @Singular
    List<RawRow> rows;

    public int width() {
        int width = headers.size();
        for (RawRow row : rows) {
            width = Math.max(width, row.width());
        }
        return width;
    }
}
