package com.flightops.diversion.exception;

public class DataFeedUnavailableException extends DiversionException {

    private static final String ERROR_CODE = "DATA_FEED_UNAVAILABLE";

    public DataFeedUnavailableException(String message) {
        super(ERROR_CODE, message, true);
    }

    public DataFeedUnavailableException(String message, Throwable cause) {
        super(ERROR_CODE, message, true, cause);
    }
}
