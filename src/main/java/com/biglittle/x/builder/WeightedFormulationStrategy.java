package com.biglittle.x.builder;

import com.biglittle.x.dto.MatchPair;
import com.biglittle.x.dto.SolveOptions;
import com.biglittle.x.dto.enums.ProblemVariant;
import com.biglittle.x.preference.PreferenceProfile;
import com.biglittle.x.processors.backend.BoolVariable;
import com.biglittle.x.processors.backend.ConstraintModel;
import com.biglittle.x.service.ScoreCalculator;
import com.google.common.collect.ImmutableMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Capacity-aware optimization: every participant gets between 1 and its capacity partners (or exactly one),
 * and the blended preference score of the chosen pairs is maximized. No stability constraints.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WeightedFormulationStrategy extends AbstractFormulationStrategy {

    private final ScoreCalculator scoreCalculator;

    @Override
    public boolean supports(ProblemVariant variant) {
        return variant == ProblemVariant.WEIGHTED_OPTIMIZE;
    }

    @Override
    protected boolean includePair(PreferenceProfile profile, String proposer, String receiver) {
        return true;
    }

    @Override
    public FormulatedModel formulate(PreferenceProfile profile, SolveOptions options) {
        SolveOptions effective = options == null ? SolveOptions.defaults() : options;
        ConstraintModel model = new ConstraintModel();
        ImmutableMap<MatchPair, BoolVariable> decisions = createDecisionVariables(model, profile);

        for (String receiver : profile.receiverIds()) {
            List<BoolVariable> vars = variablesOfReceiver(profile, decisions, receiver);
            if (effective.isEnforceExactlyOne()) {
                model.addExactlyOne("receiver_" + receiver, vars);
            } else {
                model.addLinear("receiver_" + receiver, vars, 1, profile.receiverCapacity(receiver));
            }
        }
        for (String proposer : profile.proposerIds()) {
            List<BoolVariable> vars = variablesOfProposer(profile, decisions, proposer);
            if (effective.isEnforceExactlyOne()) {
                model.addExactlyOne("proposer_" + proposer, vars);
            } else {
                model.addLinear("proposer_" + proposer, vars, 1, profile.proposerCapacity(proposer));
            }
        }
        addForcedPairs(model, decisions, effective);

        ImmutableMap.Builder<MatchPair, Double> scores = ImmutableMap.builder();
        Map<BoolVariable, Double> objective = new LinkedHashMap<>();
        decisions.forEach((pair, variable) -> {
            double score = scoreCalculator.calculate(profile, pair.getProposer(), pair.getReceiver(), effective.getWeight());
            scores.put(pair, score);
            objective.put(variable, score);
        });
        model.maximize(objective);

        log.debug("Formulated weighted model: decisions={}, weight={}, exactlyOne={}",
                decisions.size(), effective.getWeight(), effective.isEnforceExactlyOne());
        return new FormulatedModel(ProblemVariant.WEIGHTED_OPTIMIZE, model, decisions, scores.build());
    }
}
