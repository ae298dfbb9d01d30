package com.bmsedge.sellout.dto;

import lombok.Value;

import java.util.List;

/**
 * One sheet row as read, before any cleaning. Cells are rendered text, "" when blank.
 */
@Value
public class RawRow {

    /** Zero-based row number in the sheet. */
    int rowNumber;
    List<String> cells;

    public String cell(int index) {
        if (index < 0 || index >= cells.size()) {
            return "";
        }
        String value = cells.get(index);
        return value == null ? "" : value;
    }

    public int width() {
        return cells.size();
    }

    public boolean isBlank() {
        return cells.stream().allMatch(cell -> cell == null || cell.isBlank());
    }
}
