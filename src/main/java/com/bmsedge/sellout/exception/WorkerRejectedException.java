package com.bmsedge.sellout.exception;

public class WorkerRejectedException extends IngestionException {

    public static final String CODE = "WORKER_REJECTED";

    public WorkerRejectedException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
