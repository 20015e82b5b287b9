package com.biglittle.x.processors.backend;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class BackendSolution {
    private final BackendStatus status;
    private final boolean[] values;
    private final Double objectiveValue;

    public static BackendSolution solved(BackendStatus status, boolean[] values, Double objectiveValue) {
        if (!status.hasSolution()) {
            throw new IllegalArgumentException("Status " + status + " carries no assignment");
        }
        return new BackendSolution(status, values.clone(), objectiveValue);
    }

    public static BackendSolution infeasible() {
        return new BackendSolution(BackendStatus.INFEASIBLE, new boolean[0], null);
    }

    public static BackendSolution timedOut() {
        return new BackendSolution(BackendStatus.TIMED_OUT, new boolean[0], null);
    }

    public boolean valueOf(BoolVariable variable) {
        return values[variable.getIndex()];
    }

    public boolean[] getValues() {
        return values.clone();
    }
}
