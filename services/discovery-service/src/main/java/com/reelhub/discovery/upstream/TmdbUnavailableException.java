package com.reelhub.discovery.upstream;

/**
 * Transient provider failure: retries exhausted, circuit open or an unreadable response.
 */
public class TmdbUnavailableException extends RuntimeException {
    public TmdbUnavailableException(String message) {
        super(message);
    }

    public TmdbUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
