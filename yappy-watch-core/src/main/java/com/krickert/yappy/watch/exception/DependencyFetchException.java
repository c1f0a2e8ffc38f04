package com.krickert.yappy.watch.exception;

/**
 * A transport or backend error, wrapped with the identity of the dependency that hit it.
 * Retryable according to the caller's own policy.
 */
public class DependencyFetchException extends DependencyException {

    public DependencyFetchException(String dependencyId, Throwable cause) {
        super(dependencyId + ": " + cause.getMessage(), cause);
    }

    public DependencyFetchException(String dependencyId, String message) {
        super(dependencyId + ": " + message);
    }
}
