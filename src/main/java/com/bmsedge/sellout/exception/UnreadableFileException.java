package com.bmsedge.sellout.exception;

public class UnreadableFileException extends IngestionException {

    public static final String CODE = "UNREADABLE_FILE";

    public UnreadableFileException(String message) {
        super(CODE, message);
    }

    public UnreadableFileException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
