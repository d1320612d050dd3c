package com.flightops.diversion.exception;

/**
 * Thrown when a caller hands the decision core malformed input.
 * Business outcomes (illegal crew, infeasible scenario) are never reported this way.
 */
public class DiversionValidationException extends DiversionException {

    private static final String ERROR_CODE = "VALIDATION_ERROR";

    public DiversionValidationException(String message) {
        super(ERROR_CODE, message, false);
    }
}
