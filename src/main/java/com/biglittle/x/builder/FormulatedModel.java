package com.biglittle.x.builder;

import com.biglittle.x.dto.MatchPair;
import com.biglittle.x.dto.Matching;
import com.biglittle.x.dto.enums.ProblemVariant;
import com.biglittle.x.processors.backend.BackendSolution;
import com.biglittle.x.processors.backend.BoolVariable;
import com.biglittle.x.processors.backend.ConstraintModel;
import com.google.common.collect.ImmutableMap;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A constraint model together with the pair each decision variable stands for.
 */
@Getter
@AllArgsConstructor
public class FormulatedModel {
    private final ProblemVariant variant;
    private final ConstraintModel model;
    private final ImmutableMap<MatchPair, BoolVariable> decisions;
    private final ImmutableMap<MatchPair, Double> scores;

    public Matching decode(BackendSolution solution) {
        List<MatchPair> pairs = new ArrayList<>();
        decisions.forEach((pair, variable) -> {
            if (solution.valueOf(variable)) {
                pairs.add(pair);
            }
        });
        return Matching.of(pairs);
    }

    public Map<MatchPair, Double> scoresOf(Matching matching) {
        Map<MatchPair, Double> selected = new LinkedHashMap<>();
        for (MatchPair pair : matching.getPairs()) {
            Double score = scores.get(pair);
            if (score != null) {
                selected.put(pair, score);
            }
        }
        return selected;
    }
}
