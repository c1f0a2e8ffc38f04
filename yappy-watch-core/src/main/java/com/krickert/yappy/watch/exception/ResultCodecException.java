package com.krickert.yappy.watch.exception;

/**
 * A fetched result could not be serialized or deserialized.
 */
public class ResultCodecException extends RuntimeException {

    public ResultCodecException(String message) {
        super(message);
    }

    public ResultCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
