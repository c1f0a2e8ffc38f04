package com.krickert.yappy.watch.exception;

/**
 * Raised when a dependency was stopped before or during a fetch. This is cooperative
 * cancellation, not a failure: callers should stop polling and must not log it as an error.
 */
public class DependencyStoppedException extends DependencyException {

    public DependencyStoppedException(String dependencyId) {
        super(dependencyId + ": dependency stopped");
    }
}
