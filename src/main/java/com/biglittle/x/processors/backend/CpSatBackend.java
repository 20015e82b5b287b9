package com.biglittle.x.processors.backend;

import com.biglittle.x.config.SolverProperties;
import com.biglittle.x.exceptions.BackendException;
import com.google.ortools.Loader;
import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.DoubleLinearExpr;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.Literal;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * {@link ConstraintBackend} on top of OR-Tools CP-SAT. A fresh {@link CpModel} and {@link CpSolver}
 * are created for every call.
 */
@Slf4j
public class CpSatBackend implements ConstraintBackend {
    private static volatile boolean nativesLoaded;

    private final SolverProperties properties;

    public CpSatBackend(SolverProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return "cp-sat";
    }

    @Override
    public BackendSolution solve(ConstraintModel model, Duration timeLimit) {
        loadNativeLibraries();

        CpModel cpModel = new CpModel();
        BoolVar[] vars = translate(model, cpModel);

        CpSolver solver = new CpSolver();
        solver.getParameters()
                .setMaxTimeInSeconds(timeLimit.toMillis() / 1000.0)
                .setNumWorkers(properties.getNumWorkers())
                .setLogSearchProgress(properties.isLogSearchProgress());

        CpSolverStatus status;
        try {
            status = solver.solve(cpModel);
        } catch (RuntimeException e) {
            log.error("CP-SAT failed on model with {} variables", model.size(), e);
            throw new BackendException("CP-SAT solver failed: " + e.getMessage(), e);
        }
        log.debug("CP-SAT finished: status={}, variables={}, wallTime={}s", status, model.size(), solver.wallTime());
        if (log.isTraceEnabled()) {
            log.trace(solver.responseStats());
        }

        switch (status) {
            case OPTIMAL:
            case FEASIBLE:
                boolean[] values = new boolean[vars.length];
                for (int i = 0; i < vars.length; i++) {
                    values[i] = Boolean.TRUE.equals(solver.booleanValue(vars[i]));
                }
                Double objective = model.hasObjective() ? solver.objectiveValue() : null;
                return BackendSolution.solved(
                        status == CpSolverStatus.OPTIMAL ? BackendStatus.OPTIMAL : BackendStatus.FEASIBLE,
                        values, objective);
            case INFEASIBLE:
                return BackendSolution.infeasible();
            case UNKNOWN:
                log.warn("CP-SAT stopped without a solution after {}s (limit {} ms)", solver.wallTime(), timeLimit.toMillis());
                return BackendSolution.timedOut();
            case MODEL_INVALID:
                throw new IllegalStateException("CP-SAT rejected the model: " + solver.getSolutionInfo());
            default:
                throw new BackendException("Unexpected CP-SAT status " + status);
        }
    }

    private BoolVar[] translate(ConstraintModel model, CpModel cpModel) {
        BoolVar[] vars = new BoolVar[model.size()];
        for (BoolVariable variable : model.getVariables()) {
            vars[variable.getIndex()] = cpModel.newBoolVar(variable.getName());
        }

        for (LinearConstraint constraint : model.getLinearConstraints()) {
            cpModel.addLinearConstraint(LinearExpr.sum(select(vars, constraint.getVariables())),
                    constraint.getLowerBound(), constraint.getUpperBound());
        }

        for (OrEquivalence equivalence : model.getEquivalences()) {
            BoolVar target = vars[equivalence.getTarget().getIndex()];
            if (equivalence.getMembers().isEmpty()) {
                cpModel.addEquality(target, 0);
                continue;
            }
            LinearExpr sum = LinearExpr.sum(select(vars, equivalence.getMembers()));
            cpModel.addGreaterOrEqual(sum, 1).onlyEnforceIf(target);
            cpModel.addEquality(sum, 0).onlyEnforceIf(target.not());
        }

        for (Disjunction disjunction : model.getDisjunctions()) {
            cpModel.addBoolOr(select(vars, disjunction.getVariables()));
        }

        if (model.hasObjective()) {
            Map<BoolVariable, Double> coefficients = model.objectiveCoefficients();
            Literal[] literals = new Literal[coefficients.size()];
            double[] weights = new double[coefficients.size()];
            int i = 0;
            for (Map.Entry<BoolVariable, Double> entry : coefficients.entrySet()) {
                literals[i] = vars[entry.getKey().getIndex()];
                weights[i] = entry.getValue();
                i++;
            }
            cpModel.maximize(new DoubleLinearExpr(literals, weights, 0.0));
        }
        return vars;
    }

    private static BoolVar[] select(BoolVar[] vars, List<BoolVariable> variables) {
        BoolVar[] selected = new BoolVar[variables.size()];
        for (int i = 0; i < selected.length; i++) {
            selected[i] = vars[variables.get(i).getIndex()];
        }
        return selected;
    }

    private static void loadNativeLibraries() {
        if (nativesLoaded) {
            return;
        }
        synchronized (CpSatBackend.class) {
            if (nativesLoaded) {
                return;
            }
            try {
                Loader.loadNativeLibraries();
                nativesLoaded = true;
            } catch (RuntimeException | UnsatisfiedLinkError e) {
                log.error("Unable to load OR-Tools native libraries", e);
                throw new BackendException("OR-Tools native libraries are unavailable", e);
            }
        }
    }
}
