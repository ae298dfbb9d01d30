package com.bmsedge.sellout.exception;

/**
 * A record bound for storage holds a value that is not wire-safe.
 */
public class EncodingException extends IngestionException {

    public static final String CODE = "ENCODING_ERROR";

    public EncodingException(String message) {
        super(CODE, message);
    }

    public EncodingException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
