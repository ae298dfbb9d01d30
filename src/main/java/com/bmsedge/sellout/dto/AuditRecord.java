package com.bmsedge.sellout.dto;

import lombok.Value;

@Value
public class AuditRecord {
    int rowIndex;
    String columnName;
    String originalValue;
    String cleanedValue;
    String transformationType;
}
