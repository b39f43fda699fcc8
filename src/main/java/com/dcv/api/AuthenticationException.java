package com.dcv.api;

/**
 * Exception thrown when logging in to the DNS provider fails.
 * <p>Fatal for a whole run since no record can be provisioned without it.
 */
public class AuthenticationException extends ApiException {

    public AuthenticationException(String message) {
        super(Kind.STATUS, message);
    }

    public AuthenticationException(String message, int statusCode) {
        super(Kind.STATUS, message, statusCode);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(Kind.TRANSPORT, message, cause);
    }
}
