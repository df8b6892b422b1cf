package com.reelhub.discovery.upstream;

/**
 * Permanent provider failure (4xx other than 429). Never retried.
 */
public class TmdbRequestException extends RuntimeException {
    private final int status;
    private final String responseBody;

    public TmdbRequestException(int status, String message, String responseBody) {
        super(message);
        this.status = status;
        this.responseBody = responseBody;
    }

    public int getStatus() {
        return status;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isNotFound() {
        return status == 404;
    }
}
