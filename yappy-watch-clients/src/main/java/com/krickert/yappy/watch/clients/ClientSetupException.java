package com.krickert.yappy.watch.clients;

/**
 * A backend client could not be created or authenticated.
 */
public class ClientSetupException extends RuntimeException {

    public ClientSetupException(String message) {
        super(message);
    }

    public ClientSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
