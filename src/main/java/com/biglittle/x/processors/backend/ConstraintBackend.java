package com.biglittle.x.processors.backend;

import java.time.Duration;

/**
 * Black-box boolean/integer optimizer. One call per solve, synchronous.
 */
public interface ConstraintBackend {

    /**
     * @param model     model to solve, not modified
     * @param timeLimit upper bound on search time
     * @return an assignment, or the INFEASIBLE / TIMED_OUT status
     * @throws com.biglittle.x.exceptions.BackendException when the solver fails for other reasons
     */
    BackendSolution solve(ConstraintModel model, Duration timeLimit);

    String name();
}
