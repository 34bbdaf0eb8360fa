package com.tthblock.core.sync;

/**
 * A fetch attempt failed in a way that may succeed on the next attempt
 * (network error, HTTP error status, wrong content type, unusable body).
 */
public class RetryableFetchException extends Exception {
    public RetryableFetchException(String message) {
        super(message);
    }

    public RetryableFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
