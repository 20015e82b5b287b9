package com.biglittle.x.processors.backend;

import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Data;

/** At least one of the variables is true. */
@Data
@AllArgsConstructor
public class Disjunction {
    private final String name;
    private final ImmutableList<BoolVariable> variables;

    public boolean isSatisfiedBy(boolean[] values) {
        return variables.stream().anyMatch(v -> values[v.getIndex()]);
    }
}
