package com.bmsedge.sellout.exception;

/**
 * Month/year of the report could not be derived. Never defaulted, so the whole file fails.
 */
public class DateDerivationException extends IngestionException {

    public static final String CODE = "DATE_DERIVATION_FAILED";

    public DateDerivationException(String message) {
        super(CODE, message);
    }
}
