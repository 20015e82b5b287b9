package com.biglittle.x.builder;

import com.biglittle.x.dto.MatchPair;
import com.biglittle.x.dto.SolveOptions;
import com.biglittle.x.preference.PreferenceModel;
import com.biglittle.x.preference.PreferenceProfile;
import com.biglittle.x.processors.backend.BoolVariable;
import com.biglittle.x.processors.backend.ConstraintModel;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stable matching model shared by the three stability variants.
 * <p>
 * For every pair (p, r) with a decision variable that is not forced, the model requires
 * {@code x(p,r) OR pBetter OR rBetter}, where {@code pBetter} is an auxiliary tied by an
 * {@link com.biglittle.x.processors.backend.OrEquivalence} to "p is matched to a receiver it ranks
 * at least as well as r" (strictly better under {@link #strictComparison()}), and symmetrically for r.
 * No objective is set; the backend only searches for a feasible point.
 * </p>
 */
@Slf4j
public abstract class StabilityFormulationStrategy extends AbstractFormulationStrategy {

    /** {@code true}: only strictly better partners discharge a pair; {@code false}: ties do as well. */
    protected abstract boolean strictComparison();

    /** {@code true}: exactly one partner each; {@code false}: at most one. */
    protected abstract boolean exactlyOne();

    @Override
    public FormulatedModel formulate(PreferenceProfile profile, SolveOptions options) {
        ConstraintModel model = new ConstraintModel();
        ImmutableMap<MatchPair, BoolVariable> decisions = createDecisionVariables(model, profile);

        for (String proposer : profile.proposerIds()) {
            addCardinality(model, "proposer_" + proposer, variablesOfProposer(profile, decisions, proposer));
        }
        for (String receiver : profile.receiverIds()) {
            addCardinality(model, "receiver_" + receiver, variablesOfReceiver(profile, decisions, receiver));
        }

        Set<MatchPair> forced = addForcedPairs(model, decisions, options);
        int clauses = addStabilityConstraints(model, profile, decisions, forced);

        log.debug("Formulated {} model: decisions={}, variables={}, stabilityClauses={}, forced={}",
                profile.getVariant(), decisions.size(), model.size(), clauses, forced.size());
        return new FormulatedModel(profile.getVariant(), model, decisions, ImmutableMap.of());
    }

    private void addCardinality(ConstraintModel model, String name, List<BoolVariable> vars) {
        if (exactlyOne()) {
            model.addExactlyOne(name, vars);
        } else {
            model.addAtMostOne(name, vars);
        }
    }

    private int addStabilityConstraints(ConstraintModel model, PreferenceProfile profile,
                                        Map<MatchPair, BoolVariable> decisions, Set<MatchPair> forced) {
        PreferenceModel proposerModel = profile.getProposerModel();
        PreferenceModel receiverModel = profile.getReceiverModel();
        int clauses = 0;

        for (Map.Entry<MatchPair, BoolVariable> entry : decisions.entrySet()) {
            MatchPair pair = entry.getKey();
            if (forced.contains(pair)) {
                continue;
            }
            String proposer = pair.getProposer();
            String receiver = pair.getReceiver();

            int proposerPivot = proposerModel.rankOf(proposer, receiver);
            List<BoolVariable> proposerBetter = new ArrayList<>();
            for (String other : profile.receiverIds()) {
                BoolVariable var = decisions.get(MatchPair.of(proposer, other));
                if (var != null && discharges(proposerModel.rankOf(proposer, other), proposerPivot)) {
                    proposerBetter.add(var);
                }
            }

            int receiverPivot = receiverModel.rankOf(receiver, proposer);
            List<BoolVariable> receiverBetter = new ArrayList<>();
            for (String other : profile.proposerIds()) {
                BoolVariable var = decisions.get(MatchPair.of(other, receiver));
                if (var != null && discharges(receiverModel.rankOf(receiver, other), receiverPivot)) {
                    receiverBetter.add(var);
                }
            }

            BoolVariable pBetter = model.newAuxiliaryVariable("p_better_" + proposer + "_" + receiver);
            model.addOrEquivalence(pBetter, proposerBetter);
            BoolVariable rBetter = model.newAuxiliaryVariable("r_better_" + proposer + "_" + receiver);
            model.addOrEquivalence(rBetter, receiverBetter);

            model.addDisjunction("stable_" + proposer + "_" + receiver, List.of(entry.getValue(), pBetter, rBetter));
            clauses++;
        }
        return clauses;
    }

    private boolean discharges(int candidateRank, int pivotRank) {
        return strictComparison() ? candidateRank < pivotRank : candidateRank <= pivotRank;
    }
}
