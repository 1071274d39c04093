package com.bmsedge.forecast.exception;

/**
 * Raised when a caller supplies a series or parameter the engine cannot interpret.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
