package com.bmsedge.sellout.exception;

public class LoaderTimeoutException extends IngestionException {

    public static final String CODE = "LOADER_TIMEOUT";

    public LoaderTimeoutException(String message) {
        super(CODE, message);
    }
}
