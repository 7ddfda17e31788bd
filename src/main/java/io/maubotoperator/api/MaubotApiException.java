package io.maubotoperator.api;

public final class MaubotApiException extends Exception {
    private final int statusCode;

    public MaubotApiException(String message) {
        this(message, -1, null);
    }

    public MaubotApiException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public MaubotApiException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    private MaubotApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the API, or {@code -1} when no response was received.
     */
    public int statusCode() {
        return statusCode;
    }
}
