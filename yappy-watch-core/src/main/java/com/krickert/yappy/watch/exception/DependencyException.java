package com.krickert.yappy.watch.exception;

/**
 * Base type for every failure a dependency fetch can raise.
 */
public class DependencyException extends RuntimeException {

    public DependencyException(String message) {
        super(message);
    }

    public DependencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
