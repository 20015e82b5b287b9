package com.biglittle.x.exceptions;

/**
 * Exception thrown when participants, preference lists, options or a serialized matching are malformed.
 * <p>
 * Raised eagerly, before any constraint model is built or any algorithm runs, so a caller never
 * observes a partial matching for rejected input.
 * </p>
 */
public class InvalidInputException extends MatchingException {

    /**
     * Constructs a new InvalidInputException with the specified detail message.
     *
     * @param message the detail message which names the offending participant or value.
     */
    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
