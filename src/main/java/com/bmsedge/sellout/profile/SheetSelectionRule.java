package com.bmsedge.sellout.profile;

import lombok.Value;

import java.util.List;
import java.util.Locale;

@Value
public class SheetSelectionRule {

    private static final SheetSelectionRule FIRST = new SheetSelectionRule(null);

    String preferredNameFragment;

    public static SheetSelectionRule firstSheet() {
        return FIRST;
    }

    public static SheetSelectionRule preferNameContaining(String fragment) {
        return new SheetSelectionRule(fragment.toLowerCase(Locale.ROOT));
    }

    /**
     * Index of the sheet to read. Falls back to the first sheet when no name matches.
     */
    public int select(List<String> sheetNames) {
        if (preferredNameFragment != null) {
            for (int i = 0; i < sheetNames.size(); i++) {
                String name = sheetNames.get(i);
                if (name != null && name.toLowerCase(Locale.ROOT).contains(preferredNameFragment)) {
                    return i;
                }
            }
        }
        return 0;
    }
}
