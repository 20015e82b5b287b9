package com.biglittle.x.dto;

import com.biglittle.x.dto.enums.ProblemVariant;
import com.biglittle.x.dto.enums.SolverPath;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class MatchingResult {
    private final ProblemVariant variant;
    private final Matching matching;
    private final Double objectiveValue;
    @Builder.Default
    private final Map<MatchPair, Double> pairScores = Map.of();
    @Builder.Default
    private final List<BlockingPair> blockingPairs = List.of();
    private final SolverPath solverPath;
    private final long durationMs;

    public boolean isStable() {
        return blockingPairs.isEmpty();
    }
}
