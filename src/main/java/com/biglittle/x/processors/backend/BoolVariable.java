package com.biglittle.x.processors.backend;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A 0/1 variable of a {@link ConstraintModel}. Identity is the index inside its model.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public final class BoolVariable {
    private final int index;
    private final String name;
    /** Auxiliary variables are fully determined by decision variables through an {@link OrEquivalence}. */
    private final boolean auxiliary;

    @Override
    public String toString() {
        return name;
    }
}
