package com.biglittle.x.matcher.strategies;

import com.biglittle.x.builder.FormulatedModel;
import com.biglittle.x.builder.FormulationStrategyContext;
import com.biglittle.x.config.SolverProperties;
import com.biglittle.x.dto.Matching;
import com.biglittle.x.dto.SolveOptions;
import com.biglittle.x.dto.SolvedMatching;
import com.biglittle.x.dto.enums.ProblemVariant;
import com.biglittle.x.dto.enums.SolverPath;
import com.biglittle.x.exceptions.InvalidInputException;
import com.biglittle.x.exceptions.NoStableMatchingException;
import com.biglittle.x.exceptions.SolverTimeoutException;
import com.biglittle.x.preference.PreferenceProfile;
import com.biglittle.x.processors.backend.BackendSolution;
import com.biglittle.x.processors.backend.BackendStatus;
import com.biglittle.x.processors.backend.ConstraintBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

@Slf4j
@Component("constraintBackendMatchingStrategy")
@RequiredArgsConstructor
public class ConstraintBackendMatchingStrategy implements MatchingStrategy {

    private final FormulationStrategyContext formulationStrategyContext;
    private final ConstraintBackend backend;
    private final SolverProperties solverProperties;

    @Override
    public boolean supports(SolverPath path) {
        return path == SolverPath.CONSTRAINT_BACKEND;
    }

    @Override
    public SolvedMatching match(PreferenceProfile profile, SolveOptions options) {
        SolveOptions effective = options == null ? SolveOptions.defaults() : options;
        ProblemVariant variant = profile.getVariant();
        FormulatedModel formulated = formulationStrategyContext.resolve(variant).formulate(profile, effective);

        Duration timeLimit = effective.getTimeLimit() != null ? effective.getTimeLimit() : solverProperties.getTimeLimit();
        BackendSolution solution = backend.solve(formulated.getModel(), timeLimit);
        log.info("Backend {} finished: variant={}, status={}, variables={}",
                backend.name(), variant, solution.getStatus(), formulated.getModel().size());

        if (solution.getStatus() == BackendStatus.INFEASIBLE) {
            if (variant.isStabilityConstrained()) {
                throw new NoStableMatchingException(variant, "backend proved the stability model infeasible");
            }
            if (effective.getForcedPairs() != null && !effective.getForcedPairs().isEmpty()) {
                throw new InvalidInputException("Forced pairs leave no assignment within the capacities");
            }
            throw new IllegalStateException("Weighted model infeasible although capacities passed the pre-check");
        }
        if (solution.getStatus() == BackendStatus.TIMED_OUT) {
            throw new SolverTimeoutException(timeLimit);
        }
        if (solution.getStatus() == BackendStatus.FEASIBLE) {
            log.warn("Time limit {} reached for variant={}, returning best feasible solution", timeLimit, variant);
        }

        List<String> violations = formulated.getModel().violations(solution.getValues());
        if (!violations.isEmpty()) {
            throw new IllegalStateException("Backend solution violates constraints " + violations);
        }

        Matching matching = formulated.decode(solution);
        return SolvedMatching.builder()
                .matching(matching)
                .objectiveValue(formulated.getModel().hasObjective() ? solution.getObjectiveValue() : null)
                .pairScores(formulated.scoresOf(matching))
                .build();
    }
}
