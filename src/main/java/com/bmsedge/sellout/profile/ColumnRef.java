package com.bmsedge.sellout.profile;

import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Locates a column either by one of several header aliases or by a fixed zero-based position.
 */
@Value
public class ColumnRef {

    List<String> aliases;
    Integer position;

    public static ColumnRef named(String... aliases) {
        List<String> normalized = Arrays.stream(aliases)
                .map(ColumnRef::normalizeHeader)
                .collect(Collectors.toList());
        return new ColumnRef(normalized, null);
    }

    public static ColumnRef at(int position) {
        return new ColumnRef(List.of(), position);
    }

    public boolean isPositional() {
        return position != null;
    }

    /**
     * @return the column index, or -1 when the column is not present
     */
    public int resolve(List<String> headers, int width) {
        if (isPositional()) {
            return position < width ? position : -1;
        }
        for (String alias : aliases) {
            for (int i = 0; i < headers.size(); i++) {
                if (alias.equals(normalizeHeader(headers.get(i)))) {
                    return i;
                }
            }
        }
        return -1;
    }

    public static String normalizeHeader(String header) {
        if (header == null) return "";
        return header.replace('_', ' ').trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
