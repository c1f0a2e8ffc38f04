package com.krickert.yappy.watch.exception;

/**
 * A backend answered with an HTTP error status. Client adapters raise it so callers can tell a
 * rejected request (4xx) from a transport failure without knowing the HTTP library.
 */
public class BackendResponseException extends RuntimeException {

    private final int statusCode;

    public BackendResponseException(int statusCode, String message) {
        super("Unexpected response code: " + statusCode + " (" + message + ")");
        this.statusCode = statusCode;
    }

    public BackendResponseException(int statusCode, String message, Throwable cause) {
        super("Unexpected response code: " + statusCode + " (" + message + ")", cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isBadRequest() {
        return statusCode == 400;
    }
}
