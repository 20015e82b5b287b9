package com.biglittle.x.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
@AllArgsConstructor
public class SolvedMatching {
    private final Matching matching;
    private final Double objectiveValue;
    @Builder.Default
    private final Map<MatchPair, Double> pairScores = Map.of();
}
