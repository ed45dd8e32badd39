package com.healthtwin.exception;

/**
 * Raised when caller-supplied input cannot be interpreted: missing demographics,
 * a negative duration, empty tabular input, or a non-numeric value for a numeric parameter.
 */
public class InvalidSimulationInputException extends IllegalArgumentException {

    public InvalidSimulationInputException(String message) {
        super(message);
    }

    public InvalidSimulationInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
