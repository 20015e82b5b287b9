package com.biglittle.x.processors.backend;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backend-neutral boolean model: linear cardinality constraints, OR-equivalences, disjunctions and an
 * optional linear objective to maximize.
 * <p>
 * A model is built for exactly one solve and then discarded; nothing is shared between solves.
 * </p>
 */
@Getter
public final class ConstraintModel {
    private final List<BoolVariable> variables = new ArrayList<>();
    private final List<LinearConstraint> linearConstraints = new ArrayList<>();
    private final List<OrEquivalence> equivalences = new ArrayList<>();
    private final List<Disjunction> disjunctions = new ArrayList<>();
    private final Map<BoolVariable, Double> objective = new LinkedHashMap<>();

    public BoolVariable newDecisionVariable(String name) {
        return register(name, false);
    }

    public BoolVariable newAuxiliaryVariable(String name) {
        return register(name, true);
    }

    /**
     * Adds {@code lowerBound <= sum(vars) <= upperBound}. An empty sum is only accepted when 0 is within bounds.
     */
    public void addLinear(String name, Collection<BoolVariable> vars, long lowerBound, long upperBound) {
        if (lowerBound > upperBound) {
            throw new IllegalStateException("Constraint " + name + " has empty bounds [" + lowerBound + ", " + upperBound + "]");
        }
        if (vars.isEmpty()) {
            if (lowerBound > 0) {
                throw new IllegalStateException("Constraint " + name + " needs " + lowerBound + " of zero variables");
            }
            return;
        }
        linearConstraints.add(new LinearConstraint(name, ImmutableList.copyOf(vars), lowerBound, upperBound));
    }

    public void addExactlyOne(String name, Collection<BoolVariable> vars) {
        addLinear(name, vars, 1, 1);
    }

    public void addAtMostOne(String name, Collection<BoolVariable> vars) {
        addLinear(name, vars, 0, 1);
    }

    public void fix(BoolVariable variable, boolean value) {
        long v = value ? 1 : 0;
        addLinear("fix_" + variable.getName(), List.of(variable), v, v);
    }

    public void addOrEquivalence(BoolVariable target, Collection<BoolVariable> members) {
        if (!target.isAuxiliary()) {
            throw new IllegalStateException("OR-equivalence target " + target + " must be auxiliary");
        }
        if (members.stream().anyMatch(BoolVariable::isAuxiliary)) {
            throw new IllegalStateException("OR-equivalence " + target + " may only range over decision variables");
        }
        equivalences.add(new OrEquivalence(target, ImmutableList.copyOf(members)));
    }

    public void addDisjunction(String name, Collection<BoolVariable> vars) {
        disjunctions.add(new Disjunction(name, ImmutableList.copyOf(vars)));
    }

    public void maximize(Map<BoolVariable, Double> coefficients) {
        objective.clear();
        objective.putAll(coefficients);
    }

    public boolean hasObjective() {
        return !objective.isEmpty();
    }

    public List<BoolVariable> decisionVariables() {
        return variables.stream().filter(v -> !v.isAuxiliary()).collect(ImmutableList.toImmutableList());
    }

    public Map<BoolVariable, Double> objectiveCoefficients() {
        return ImmutableMap.copyOf(objective);
    }

    public double objectiveValue(boolean[] values) {
        return objective.entrySet().stream()
                .filter(e -> values[e.getKey().getIndex()])
                .mapToDouble(Map.Entry::getValue)
                .sum();
    }

    /**
     * Lists every constraint the assignment violates; empty when the assignment is feasible.
     */
    public List<String> violations(boolean[] values) {
        if (values.length != variables.size()) {
            return List.of("assignment has " + values.length + " values for " + variables.size() + " variables");
        }
        List<String> violated = new ArrayList<>();
        linearConstraints.stream().filter(c -> !c.isSatisfiedBy(values)).forEach(c -> violated.add(c.getName()));
        equivalences.stream().filter(e -> !e.isSatisfiedBy(values)).forEach(e -> violated.add("equiv_" + e.getTarget().getName()));
        disjunctions.stream().filter(d -> !d.isSatisfiedBy(values)).forEach(d -> violated.add(d.getName()));
        return violated;
    }

    public int size() {
        return variables.size();
    }

    private BoolVariable register(String name, boolean auxiliary) {
        BoolVariable variable = new BoolVariable(variables.size(), name, auxiliary);
        variables.add(variable);
        return variable;
    }
}
