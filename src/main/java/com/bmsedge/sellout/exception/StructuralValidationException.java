package com.bmsedge.sellout.exception;

public class StructuralValidationException extends IngestionException {

    public static final String CODE = "STRUCTURAL_VALIDATION_FAILED";

    public StructuralValidationException(String message) {
        super(CODE, message);
    }
}
