package com.bmsedge.sellout.dto;

import lombok.Getter;
import lombok.Setter;

/**
 * Outcome of one file's run. Created at start, finalized exactly once.
 */
@Getter
@Setter
public class ProcessingSummary {

    public enum Status {
        PROCESSING,
        COMPLETED,
        FAILED
    }

    private final String uploadId;
    private final String filename;
    private final long startedAtMillis;

    private String sourceId;
    private boolean lowConfidence;
    private int rowsProcessed;
    private int rowsCleaned;
    private int rowsSkipped;
    private int transformationsApplied;
    private int anomalies;
    private long processingTimeMs;

    @Setter(lombok.AccessLevel.NONE)
    private Status status = Status.PROCESSING;

    @Setter(lombok.AccessLevel.NONE)
    private String errorMessage;

    private ProcessingSummary(String uploadId, String filename, long startedAtMillis) {
        this.uploadId = uploadId;
        this.filename = filename;
        this.startedAtMillis = startedAtMillis;
    }

    public static ProcessingSummary start(String uploadId, String filename) {
        return new ProcessingSummary(uploadId, filename, System.currentTimeMillis());
    }

    public void complete() {
        finish(Status.COMPLETED, null);
    }

    public void fail(String message) {
        finish(Status.FAILED, message);
    }

    public boolean isFinal() {
        return status != Status.PROCESSING;
    }

    private void finish(Status finalStatus, String message) {
        if (isFinal()) {
            throw new IllegalStateException("Summary for upload " + uploadId + " already finalized as " + status);
        }
        this.status = finalStatus;
        this.errorMessage = message;
        this.processingTimeMs = System.currentTimeMillis() - startedAtMillis;
    }
}
