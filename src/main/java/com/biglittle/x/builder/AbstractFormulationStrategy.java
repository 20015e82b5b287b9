package com.biglittle.x.builder;

import com.biglittle.x.dto.MatchPair;
import com.biglittle.x.dto.SolveOptions;
import com.biglittle.x.preference.PreferenceProfile;
import com.biglittle.x.processors.backend.BoolVariable;
import com.biglittle.x.processors.backend.ConstraintModel;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decision variables, per-side cardinality and forced pairs, shared by every variant.
 */
public abstract class AbstractFormulationStrategy implements FormulationStrategy {

    /** Whether (proposer, receiver) gets a decision variable at all. */
    protected abstract boolean includePair(PreferenceProfile profile, String proposer, String receiver);

    protected ImmutableMap<MatchPair, BoolVariable> createDecisionVariables(ConstraintModel model, PreferenceProfile profile) {
        ImmutableMap.Builder<MatchPair, BoolVariable> decisions = ImmutableMap.builder();
        for (String proposer : profile.proposerIds()) {
            for (String receiver : profile.receiverIds()) {
                if (includePair(profile, proposer, receiver)) {
                    decisions.put(MatchPair.of(proposer, receiver),
                            model.newDecisionVariable("x_" + proposer + "_" + receiver));
                }
            }
        }
        return decisions.build();
    }

    protected List<BoolVariable> variablesOfProposer(PreferenceProfile profile, Map<MatchPair, BoolVariable> decisions,
                                                     String proposer) {
        List<BoolVariable> vars = new ArrayList<>();
        for (String receiver : profile.receiverIds()) {
            BoolVariable var = decisions.get(MatchPair.of(proposer, receiver));
            if (var != null) {
                vars.add(var);
            }
        }
        return vars;
    }

    protected List<BoolVariable> variablesOfReceiver(PreferenceProfile profile, Map<MatchPair, BoolVariable> decisions,
                                                     String receiver) {
        List<BoolVariable> vars = new ArrayList<>();
        for (String proposer : profile.proposerIds()) {
            BoolVariable var = decisions.get(MatchPair.of(proposer, receiver));
            if (var != null) {
                vars.add(var);
            }
        }
        return vars;
    }

    /**
     * Fixes every forced pair to 1 and returns the set of pairs that were forced.
     */
    protected Set<MatchPair> addForcedPairs(ConstraintModel model, Map<MatchPair, BoolVariable> decisions,
                                            SolveOptions options) {
        Set<MatchPair> forced = new LinkedHashSet<>();
        if (options == null || options.getForcedPairs() == null) {
            return forced;
        }
        for (MatchPair pair : options.getForcedPairs()) {
            BoolVariable var = decisions.get(pair);
            if (var == null) {
                throw new IllegalStateException("Forced pair " + pair + " has no decision variable");
            }
            model.fix(var, true);
            forced.add(pair);
        }
        return forced;
    }
}
