package com.bmsedge.sellout.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Field-level changes and row drops of one file's run, in processing order.
 * Not thread-safe; one instance per run.
 */
public class AuditTrail {

    public static final String ROW_DROPPED = "row_dropped";
    public static final String DEDUP_ANOMALY = "dedup_anomaly";

    private final List<AuditRecord> records = new ArrayList<>();
    private int rowsSkipped;
    private int anomalies;

    public void record(int rowIndex, String columnName, String originalValue, String cleanedValue, String type) {
        records.add(new AuditRecord(rowIndex, columnName, originalValue, cleanedValue, type));
    }

    /**
     * Drops a row: counted as skipped and logged with the reason as cleaned value.
     */
    public void drop(int rowIndex, String columnName, String originalValue, String reason) {
        rowsSkipped++;
        records.add(new AuditRecord(rowIndex, columnName, originalValue, reason, ROW_DROPPED));
    }

    public void anomaly(int rowIndex, String columnName, String detail) {
        anomalies++;
        records.add(new AuditRecord(rowIndex, columnName, null, detail, DEDUP_ANOMALY));
    }

    public List<AuditRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public int getRowsSkipped() {
        return rowsSkipped;
    }

    public int getAnomalies() {
        return anomalies;
    }

    /** Records other than row drops and anomalies. */
    public int getTransformationsApplied() {
        return (int) records.stream()
                .filter(r -> !ROW_DROPPED.equals(r.getTransformationType())
                        && !DEDUP_ANOMALY.equals(r.getTransformationType()))
                .count();
    }
}
