package com.bmsedge.sellout.profile;

import lombok.Builder;
import lombok.Value;

/**
 * Layout of a wide source where each month is its own column.
 */
@Value
@Builder
public class PivotShape {

    /** Metric used when no section label above the month header says otherwise. */
    @Builder.Default
    MetricType defaultMetric = MetricType.QUANTITY;

    /** Period columns end at the first "Total" header. Total columns are skipped either way. */
    boolean stopAtTotalColumn;

    /** The top-left header cell holds the report year. */
    boolean yearFromCornerCell;
}
