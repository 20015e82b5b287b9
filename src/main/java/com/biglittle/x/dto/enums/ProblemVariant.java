package com.biglittle.x.dto.enums;

/**
 * The four supported matching problems.
 * <p>
 * Each constant carries the semantics the rest of the core branches on: whether every participant must
 * rank the whole opposite side, whether everyone is matched exactly once, and whether the solution must be stable.
 * </p>
 */
public enum ProblemVariant {
    // --- Stability variants ---
    TOTAL_ORDER(true, true, true),
    RANKED_TIES(true, true, true),
    PARTIAL_TIES(false, false, true),

    // --- Optimization variant ---
    WEIGHTED_OPTIMIZE(false, false, false);

    private final boolean completeListsRequired;
    private final boolean exactlyOnePerParticipant;
    private final boolean stabilityConstrained;

    ProblemVariant(boolean completeListsRequired, boolean exactlyOnePerParticipant, boolean stabilityConstrained) {
        this.completeListsRequired = completeListsRequired;
        this.exactlyOnePerParticipant = exactlyOnePerParticipant;
        this.stabilityConstrained = stabilityConstrained;
    }

    public boolean requiresCompleteLists() {
        return completeListsRequired;
    }

    public boolean requiresExactlyOne() {
        return exactlyOnePerParticipant;
    }

    public boolean isStabilityConstrained() {
        return stabilityConstrained;
    }
}
