package com.dcv.api;

/**
 * Exception thrown when a certificate authority or DNS provider call fails.
 *
 * <p>Calls are never retried by the clients; callers decide what a failure means for their phase.
 */
public class ApiException extends Exception {

    /**
     * Failure kinds.
     */
    public enum Kind {
        /**
         * Connection level failure.
         */
        TRANSPORT,
        /**
         * Non-success response.
         */
        STATUS,
        /**
         * Domain, zone or record absent.
         */
        NOT_FOUND,
        /**
         * Expected field absent in a response.
         */
        DATA
    }

    private final Kind kind;
    private final int statusCode;

    /**
     * Constructs a new ApiException.
     *
     * @param kind    Failure kind.
     * @param message Error message.
     */
    public ApiException(Kind kind, String message) {
        this(kind, message, -1, null);
    }

    /**
     * Constructs a new ApiException with HTTP status.
     *
     * @param kind       Failure kind.
     * @param message    Error message.
     * @param statusCode HTTP status code.
     */
    public ApiException(Kind kind, String message, int statusCode) {
        this(kind, message, statusCode, null);
    }

    /**
     * Constructs a new ApiException with cause.
     *
     * @param kind    Failure kind.
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public ApiException(Kind kind, String message, Throwable cause) {
        this(kind, message, -1, cause);
    }

    private ApiException(Kind kind, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Gets HTTP status code.
     *
     * @return Status code or -1 if no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
