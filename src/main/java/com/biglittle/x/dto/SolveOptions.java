package com.biglittle.x.dto;

import com.biglittle.x.dto.enums.SolverPath;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.List;

@Data
@Builder(toBuilder = true)
public class SolveOptions {
    public static final double DEFAULT_WEIGHT = 0.5;

    /** Share of the proposer side in the blended score, weighted variant only. */
    @Builder.Default
    private final double weight = DEFAULT_WEIGHT;

    /** Weighted variant only: replaces capacity bounds with exactly one match per participant. */
    @Builder.Default
    private final boolean enforceExactlyOne = false;

    @Builder.Default
    private final List<MatchPair> forcedPairs = List.of();

    @Builder.Default
    private final SolverPath solverPath = SolverPath.AUTO;

    /** Backend time limit; {@code null} falls back to the configured default. */
    private final Duration timeLimit;

    public static SolveOptions defaults() {
        return SolveOptions.builder().build();
    }
}
