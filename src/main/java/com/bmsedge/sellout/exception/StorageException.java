package com.bmsedge.sellout.exception;

public class StorageException extends IngestionException {

    public static final String CODE = "STORAGE_FAILED";

    public StorageException(String message) {
        super(CODE, message);
    }

    public StorageException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
