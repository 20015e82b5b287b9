package com.biglittle.x.processors.backend;

import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * {@code target <=> (sum(members) >= 1)}, a two-way logical equivalence.
 * <p>
 * Backends must enforce both directions; an empty member list fixes the target to false.
 * </p>
 */
@Data
@AllArgsConstructor
public class OrEquivalence {
    private final BoolVariable target;
    private final ImmutableList<BoolVariable> members;

    public boolean isSatisfiedBy(boolean[] values) {
        boolean any = members.stream().anyMatch(v -> values[v.getIndex()]);
        return values[target.getIndex()] == any;
    }
}
