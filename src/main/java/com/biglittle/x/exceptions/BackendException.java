package com.biglittle.x.exceptions;

/**
 * Exception thrown when the constraint backend fails for reasons unrelated to feasibility.
 * <p>
 * Typical causes are missing native libraries or resource exhaustion inside the solver.
 * </p>
 */
public class BackendException extends MatchingException {

    /**
     * Constructs a new {@link BackendException} with the specified error message.
     *
     * @param m the detail message explaining the error.
     */
    public BackendException(String m) {
        super(m);
    }

    public BackendException(String m, Throwable cause) {
        super(m, cause);
    }
}
