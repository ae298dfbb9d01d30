package com.bmsedge.sellout.profile;

public enum DedupRule {
    NONE,
    /** Keep the later row of each two-row group sharing the dedup key. */
    BOTTOM_OF_PAIR
}
