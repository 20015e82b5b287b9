package com.biglittle.x.processors.backend;

public enum BackendStatus {
    OPTIMAL,
    FEASIBLE,
    INFEASIBLE,
    /** Time limit hit before any feasible point was found. */
    TIMED_OUT;

    public boolean hasSolution() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
