package com.solar.anomaly.exception;

/**
 * The device directory or reading store could not be reached, so a detection
 * run cannot produce a trustworthy result.
 */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
