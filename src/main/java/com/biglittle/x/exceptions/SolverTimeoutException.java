package com.biglittle.x.exceptions;

import lombok.Getter;

import java.time.Duration;

@Getter
public class SolverTimeoutException extends BackendException {
    private final Duration timeLimit;

    public SolverTimeoutException(Duration timeLimit) {
        super("Solver reached its time limit of " + timeLimit.toMillis() + " ms without a feasible matching");
        this.timeLimit = timeLimit;
    }
}
