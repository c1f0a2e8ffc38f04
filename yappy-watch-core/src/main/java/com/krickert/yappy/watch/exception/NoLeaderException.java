package com.krickert.yappy.watch.exception;

public class NoLeaderException extends RuntimeException {

    public NoLeaderException(String message) {
        super(message);
    }

    public NoLeaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
