package com.topolens.core.cache;

/** The metrics cache could not be reached or returned a payload that could not be parsed. */
public class MetricsQueryException extends Exception {

    public MetricsQueryException(String message) {
        super(message);
    }

    public MetricsQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
