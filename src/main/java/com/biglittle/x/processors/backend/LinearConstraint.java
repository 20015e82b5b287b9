package com.biglittle.x.processors.backend;

import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * {@code lowerBound <= sum(variables) <= upperBound}.
 */
@Data
@AllArgsConstructor
public class LinearConstraint {
    private final String name;
    private final ImmutableList<BoolVariable> variables;
    private final long lowerBound;
    private final long upperBound;

    public boolean isSatisfiedBy(boolean[] values) {
        long sum = variables.stream().filter(v -> values[v.getIndex()]).count();
        return sum >= lowerBound && sum <= upperBound;
    }
}
