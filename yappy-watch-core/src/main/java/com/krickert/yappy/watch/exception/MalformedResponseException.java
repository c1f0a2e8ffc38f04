package com.krickert.yappy.watch.exception;

/**
 * The backend answered with data that does not have the expected shape. Fatal for the fetch.
 */
public class MalformedResponseException extends DependencyException {

    public MalformedResponseException(String dependencyId, String message) {
        super(dependencyId + ": " + message);
    }
}
