package com.biglittle.x.exceptions;

/**
 * Base type for every recoverable failure reported by the matching core.
 * <p>
 * Callers can catch this type to handle all typed results (bad input, no stable matching,
 * backend failures) in one place. Internal invariant violations are never reported through
 * this hierarchy.
 * </p>
 */
public abstract class MatchingException extends RuntimeException {

    protected MatchingException(String message) {
        super(message);
    }

    protected MatchingException(String message, Throwable cause) {
        super(message, cause);
    }
}
