package com.biglittle.x.dto.enums;

public enum SolverPath {
    /** Deferred acceptance for tie-free total orders without forced pairs, constraint backend otherwise. */
    AUTO,
    DEFERRED_ACCEPTANCE,
    CONSTRAINT_BACKEND
}
