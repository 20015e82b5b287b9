package com.biglittle.x.service;

import com.biglittle.x.dto.BlockingPair;
import com.biglittle.x.dto.Matching;
import com.biglittle.x.dto.MatchingResult;
import com.biglittle.x.dto.Participant;
import com.biglittle.x.dto.SolveOptions;
import com.biglittle.x.dto.SolvedMatching;
import com.biglittle.x.dto.enums.ProblemVariant;
import com.biglittle.x.dto.enums.SolverPath;
import com.biglittle.x.exceptions.InvalidInputException;
import com.biglittle.x.exceptions.MatchingException;
import com.biglittle.x.matcher.strategies.DeferredAcceptanceMatchingStrategy;
import com.biglittle.x.matcher.strategies.MatchingStrategyContext;
import com.biglittle.x.preference.PreferenceList;
import com.biglittle.x.preference.PreferenceProfile;
import com.biglittle.x.processors.InstabilityDetector;
import com.biglittle.x.validation.PreferenceValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class MatchingServiceImpl implements MatchingService {
    private final MatchingStrategyContext matchingStrategyContext;
    private final DeferredAcceptanceMatchingStrategy deferredAcceptanceMatchingStrategy;
    private final InstabilityDetector instabilityDetector;
    private final MeterRegistry meterRegistry;

    @Override
    public MatchingResult solve(ProblemVariant variant, List<Participant> proposers, List<Participant> receivers,
                                Map<String, PreferenceList> proposerPrefs, Map<String, PreferenceList> receiverPrefs,
                                SolveOptions options) {
        SolveOptions effective = options == null ? SolveOptions.defaults() : options;
        SolverPath path = resolvePath(variant, effective);
        Timer.Sample sample = Timer.start(meterRegistry);
        Instant start = Instant.now();

        try {
            PreferenceValidator.validateSolveRequest(variant, proposers, receivers, proposerPrefs, receiverPrefs, effective);
            PreferenceProfile profile = PreferenceProfile.of(variant, proposers, receivers, proposerPrefs, receiverPrefs);
            if (effective.isEnforceExactlyOne()) {
                profile = profile.withUnitCapacity();
            }
            PreferenceValidator.validateForcedPairsAcceptable(profile, effective);

            log.info("Solving variant={}, path={}, proposers={}, receivers={}, forcedPairs={}",
                    variant, path, proposers.size(), receivers.size(),
                    effective.getForcedPairs() == null ? 0 : effective.getForcedPairs().size());
            SolvedMatching solved = matchingStrategyContext.resolve(path).match(profile, effective);

            List<BlockingPair> blockingPairs = instabilityDetector.detect(profile, solved.getMatching());
            if (!blockingPairs.isEmpty()) {
                meterRegistry.counter("matching_blocking_pairs", "variant", variant.name())
                        .increment(blockingPairs.size());
                if (variant.isStabilityConstrained()) {
                    throw new IllegalStateException("Solver returned a matching with blocking pairs " + blockingPairs);
                }
            }

            long durationMs = Duration.between(start, Instant.now()).toMillis();
            log.info("Solved variant={}, path={}, pairs={}, objective={}, blockingPairs={}, durationMs={}",
                    variant, path, solved.getMatching().size(), solved.getObjectiveValue(), blockingPairs.size(), durationMs);
            return MatchingResult.builder()
                    .variant(variant)
                    .matching(solved.getMatching())
                    .objectiveValue(solved.getObjectiveValue())
                    .pairScores(solved.getPairScores())
                    .blockingPairs(blockingPairs)
                    .solverPath(path)
                    .durationMs(durationMs)
                    .build();
        } catch (MatchingException e) {
            log.error("Solve failed for variant={}, path={}: {}", variant, path, e.getMessage());
            meterRegistry.counter("matching_solve_errors", "variant", String.valueOf(variant),
                    "error", e.getClass().getSimpleName()).increment();
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("matching_solve_duration", "variant", String.valueOf(variant),
                    "path", path.name()));
        }
    }

    @Override
    public List<BlockingPair> detectInstabilities(Matching matching, Map<String, PreferenceList> proposerPrefs,
                                                  Map<String, PreferenceList> receiverPrefs, ProblemVariant variant) {
        if (proposerPrefs == null || receiverPrefs == null) {
            throw new InvalidInputException("Preferences of both sides are required");
        }
        List<Participant> proposers = participantsOf(proposerPrefs, receiverPrefs);
        List<Participant> receivers = participantsOf(receiverPrefs, proposerPrefs);
        return detectInstabilities(matching, proposers, receivers, proposerPrefs, receiverPrefs, variant);
    }

    @Override
    public List<BlockingPair> detectInstabilities(Matching matching, List<Participant> proposers,
                                                  List<Participant> receivers, Map<String, PreferenceList> proposerPrefs,
                                                  Map<String, PreferenceList> receiverPrefs, ProblemVariant variant) {
        if (variant == null) {
            throw new InvalidInputException("Problem variant is required");
        }
        List<String> proposerIds = PreferenceValidator.validateParticipants("proposer", proposers);
        List<String> receiverIds = PreferenceValidator.validateParticipants("receiver", receivers);
        PreferenceValidator.validatePreferences(variant, "proposer", proposerIds, receiverIds, proposerPrefs);
        PreferenceValidator.validatePreferences(variant, "receiver", receiverIds, proposerIds, receiverPrefs);

        PreferenceProfile profile = PreferenceProfile.of(variant, proposers, receivers, proposerPrefs, receiverPrefs);
        return instabilityDetector.detect(profile, matching);
    }

    @Override
    public Matching deferredAcceptance(Map<String, PreferenceList> proposerPrefs, Map<String, PreferenceList> receiverPrefs) {
        if (proposerPrefs == null || receiverPrefs == null) {
            throw new InvalidInputException("Preferences of both sides are required");
        }
        List<Participant> proposers = proposerPrefs.keySet().stream().map(Participant::of).toList();
        List<Participant> receivers = receiverPrefs.keySet().stream().map(Participant::of).toList();
        List<String> proposerIds = PreferenceValidator.validateParticipants("proposer", proposers);
        List<String> receiverIds = PreferenceValidator.validateParticipants("receiver", receivers);
        PreferenceValidator.validatePreferences(ProblemVariant.TOTAL_ORDER, "proposer", proposerIds, receiverIds, proposerPrefs);
        PreferenceValidator.validatePreferences(ProblemVariant.TOTAL_ORDER, "receiver", receiverIds, proposerIds, receiverPrefs);

        PreferenceProfile profile = PreferenceProfile.of(ProblemVariant.TOTAL_ORDER, proposers, receivers,
                proposerPrefs, receiverPrefs);
        return deferredAcceptanceMatchingStrategy.deferredAcceptance(profile);
    }

    private static SolverPath resolvePath(ProblemVariant variant, SolveOptions options) {
        SolverPath requested = options.getSolverPath() == null ? SolverPath.AUTO : options.getSolverPath();
        if (requested != SolverPath.AUTO) {
            return requested;
        }
        boolean noForcedPairs = options.getForcedPairs() == null || options.getForcedPairs().isEmpty();
        return variant == ProblemVariant.TOTAL_ORDER && noForcedPairs
                ? SolverPath.DEFERRED_ACCEPTANCE
                : SolverPath.CONSTRAINT_BACKEND;
    }

    /**
     * Owners of {@code own} in key order, followed by anyone only the other side ranks.
     */
    private static List<Participant> participantsOf(Map<String, PreferenceList> own, Map<String, PreferenceList> other) {
        Set<String> ids = new LinkedHashSet<>(own.keySet());
        for (PreferenceList list : other.values()) {
            if (list != null) {
                ids.addAll(list.toRankMap().keySet());
            }
        }
        return ids.stream().map(Participant::of).toList();
    }
}
