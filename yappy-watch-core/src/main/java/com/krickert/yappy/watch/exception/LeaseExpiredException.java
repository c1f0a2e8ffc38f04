package com.krickert.yappy.watch.exception;

/**
 * The secret's lease is gone (expired or not renewable). Not retryable; the caller has to
 * re-authenticate or obtain a new credential.
 */
public class LeaseExpiredException extends DependencyException {

    public LeaseExpiredException(String message) {
        super(message);
    }

    public LeaseExpiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
