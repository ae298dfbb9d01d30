package com.bmsedge.sellout.exception;

/**
 * Base class for failures that abort the processing of a single file.
 * The error code ends up in the FAILED status message so causes stay distinguishable.
 */
public class IngestionException extends RuntimeException {

    private final String errorCode;

    public IngestionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public IngestionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String toStatusMessage() {
        return errorCode + ": " + getMessage();
    }
}
