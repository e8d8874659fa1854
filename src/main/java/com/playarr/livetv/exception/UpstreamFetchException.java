package com.playarr.livetv.exception;

/**
 * Exception thrown when an upstream M3U or EPG download fails.
 * The error type separates bad HTTP statuses from transport failures and deadlines.
 */
public class UpstreamFetchException extends RuntimeException {

    private final ErrorType errorType;
    private final String url;
    private final Integer statusCode;

    public enum ErrorType {
        /**
         * Upstream answered with a non-2xx status.
         */
        UPSTREAM_STATUS,

        /**
         * Connection refused, reset, DNS failure or a malformed URL.
         */
        NETWORK,

        /**
         * The request deadline elapsed.
         */
        TIMEOUT
    }

    public UpstreamFetchException(ErrorType errorType, String url, Integer statusCode, String message) {
        super(message);
        this.errorType = errorType;
        this.url = url;
        this.statusCode = statusCode;
    }

    public UpstreamFetchException(ErrorType errorType, String url, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.url = url;
        this.statusCode = null;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getUrl() {
        return url;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public static UpstreamFetchException badStatus(String url, int statusCode) {
        return new UpstreamFetchException(
                ErrorType.UPSTREAM_STATUS,
                url,
                statusCode,
                "Upstream responded with HTTP " + statusCode + " for " + url
        );
    }

    public static UpstreamFetchException network(String url, Throwable cause) {
        return new UpstreamFetchException(
                ErrorType.NETWORK,
                url,
                "Network error fetching " + url + ": " + cause.getMessage(),
                cause
        );
    }

    public static UpstreamFetchException timeout(String url, Throwable cause) {
        return new UpstreamFetchException(
                ErrorType.TIMEOUT,
                url,
                "Timed out fetching " + url,
                cause
        );
    }
}
