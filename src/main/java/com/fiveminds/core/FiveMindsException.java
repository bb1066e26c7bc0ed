package com.fiveminds.core;

/**
 * Base class for the engine's domain exceptions.
 */
public class FiveMindsException extends RuntimeException {

    public FiveMindsException(String message) {
        super(message);
    }

    public FiveMindsException(String message, Throwable cause) {
        super(message, cause);
    }
}
