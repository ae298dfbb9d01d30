package com.bmsedge.sellout.dto;

import com.bmsedge.sellout.profile.MetricType;
import lombok.Value;

/**
 * A month-labeled value of a wide row, waiting to be unpivoted.
 */
@Value
public class PeriodCell {
    int columnIndex;
    String header;
    int month;
    int year;
    MetricType metric;
    String rawValue;
}
