package com.marketfeed.common.exception;

/**
 * An upstream call for a cached resource failed: network error, non-2xx response or an
 * unusable payload. Never cached; the next request attempts a fresh fetch.
 */
public class FetchException extends RuntimeException {

    private final String resource;
    private final Integer statusCode;
    private final String responseBody;

    public FetchException(String resource, String message) {
        this(resource, message, null, null, null);
    }

    public FetchException(String resource, String message, Throwable cause) {
        this(resource, message, null, null, cause);
    }

    public FetchException(String resource, int statusCode, String responseBody) {
        this(resource, "HTTP " + statusCode + " - " + responseBody, statusCode, responseBody, null);
    }

    private FetchException(String resource, String message, Integer statusCode,
                           String responseBody, Throwable cause) {
        super("[" + resource + "] " + message, cause);
        this.resource     = resource;
        this.statusCode   = statusCode;
        this.responseBody = responseBody;
    }

    public String getResource() {
        return resource;
    }

    /** @return upstream HTTP status, or {@code null} when the call never got a response */
    public Integer getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
