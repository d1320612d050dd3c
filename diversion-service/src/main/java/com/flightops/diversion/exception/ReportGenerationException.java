package com.flightops.diversion.exception;

public class ReportGenerationException extends DiversionException {

    private static final String ERROR_CODE = "REPORT_GENERATION_FAILED";

    public ReportGenerationException(String message, Throwable cause) {
        super(ERROR_CODE, message, false, cause);
    }
}
