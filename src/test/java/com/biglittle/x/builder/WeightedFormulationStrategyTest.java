package com.biglittle.x.builder;

import com.biglittle.x.dto.MatchPair;
import com.biglittle.x.dto.Matching;
import com.biglittle.x.dto.Participant;
import com.biglittle.x.dto.SolveOptions;
import com.biglittle.x.dto.enums.ProblemVariant;
import com.biglittle.x.preference.PreferenceList;
import com.biglittle.x.preference.PreferenceProfile;
import com.biglittle.x.processors.WeightedScoreCalculator;
import com.biglittle.x.processors.backend.BackendSolution;
import com.biglittle.x.processors.backend.ExhaustiveBackend;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.biglittle.x.support.Scenarios.participants;
import static com.biglittle.x.support.Scenarios.prefs;
import static org.junit.jupiter.api.Assertions.*;

class WeightedFormulationStrategyTest {
    private final WeightedFormulationStrategy strategy = new WeightedFormulationStrategy(new WeightedScoreCalculator());
    private final ExhaustiveBackend backend = new ExhaustiveBackend();

    private static final Map<String, PreferenceList> PROPOSERS = prefs(
            "p", PreferenceList.ordered("x", "y"),
            "q", PreferenceList.ordered("y", "x"));
    private static final Map<String, PreferenceList> RECEIVERS = prefs(
            "x", PreferenceList.ordered("q", "p"),
            "y", PreferenceList.ordered("p", "q"));

    @Test
    void proposerWeightOnePicksProposerFavourites() {
        PreferenceProfile profile = PreferenceProfile.of(ProblemVariant.WEIGHTED_OPTIMIZE,
                participants(List.of("p", "q")), participants(List.of("x", "y")), PROPOSERS, RECEIVERS);
        SolveOptions options = SolveOptions.builder().weight(1.0).enforceExactlyOne(true).build();
        FormulatedModel formulated = strategy.formulate(profile, options);

        BackendSolution solution = backend.solve(formulated.getModel(), Duration.ofSeconds(1));
        Matching matching = formulated.decode(solution);

        assertEquals(Matching.of(MatchPair.of("p", "x"), MatchPair.of("q", "y")), matching);
        assertEquals(2.0, solution.getObjectiveValue(), 1e-9);
        assertEquals(1.0, formulated.scoresOf(matching).get(MatchPair.of("p", "x")), 1e-9);
    }

    @Test
    void receiverWeightPicksReceiverFavourites() {
        PreferenceProfile profile = PreferenceProfile.of(ProblemVariant.WEIGHTED_OPTIMIZE,
                participants(List.of("p", "q")), participants(List.of("x", "y")), PROPOSERS, RECEIVERS);
        SolveOptions options = SolveOptions.builder().weight(0.0).enforceExactlyOne(true).build();
        FormulatedModel formulated = strategy.formulate(profile, options);

        Matching matching = formulated.decode(backend.solve(formulated.getModel(), Duration.ofSeconds(1)));

        assertEquals(Matching.of(MatchPair.of("q", "x"), MatchPair.of("p", "y")), matching);
    }

    @Test
    void capacitiesLetABigTakeSeveralLittles() {
        List<Participant> bigs = List.of(Participant.of("A", 2), Participant.of("B", 1));
        Map<String, PreferenceList> bigPrefs = prefs(
                "A", PreferenceList.ordered("x", "y", "z"),
                "B", PreferenceList.ordered("x", "y", "z"));
        Map<String, PreferenceList> littlePrefs = prefs(
                "x", PreferenceList.ordered("A", "B"),
                "y", PreferenceList.ordered("A", "B"),
                "z", PreferenceList.ordered("B", "A"));
        PreferenceProfile profile = PreferenceProfile.of(ProblemVariant.WEIGHTED_OPTIMIZE,
                bigs, participants(List.of("x", "y", "z")), bigPrefs, littlePrefs);
        FormulatedModel formulated = strategy.formulate(profile, SolveOptions.defaults());

        Matching matching = formulated.decode(backend.solve(formulated.getModel(), Duration.ofSeconds(1)));

        assertEquals(3, matching.size());
        assertEquals(2, matching.partnersOfProposer("A").size());
        assertEquals(1, matching.partnersOfProposer("B").size());
        for (String little : List.of("x", "y", "z")) {
            assertEquals(1, matching.partnersOfReceiver(little).size());
        }
    }

    @Test
    void everyPairGetsAScoreAndUnrankedPairsStayEligible() {
        Map<String, PreferenceList> partial = prefs(
                "p", PreferenceList.ordered("x"),
                "q", PreferenceList.ordered("x"));
        Map<String, PreferenceList> receivers = prefs(
                "x", PreferenceList.ordered("p"),
                "y", PreferenceList.empty());
        PreferenceProfile profile = PreferenceProfile.of(ProblemVariant.WEIGHTED_OPTIMIZE,
                participants(List.of("p", "q")), participants(List.of("x", "y")), partial, receivers);
        FormulatedModel formulated = strategy.formulate(profile, SolveOptions.builder().enforceExactlyOne(true).build());

        assertEquals(4, formulated.getScores().size());
        assertEquals(0.0, formulated.getScores().get(MatchPair.of("q", "y")), 1e-9);

        Matching matching = formulated.decode(backend.solve(formulated.getModel(), Duration.ofSeconds(1)));
        assertEquals(Matching.of(MatchPair.of("p", "x"), MatchPair.of("q", "y")), matching);
    }

    @Test
    void forcedPairOverridesTheObjective() {
        PreferenceProfile profile = PreferenceProfile.of(ProblemVariant.WEIGHTED_OPTIMIZE,
                participants(List.of("p", "q")), participants(List.of("x", "y")), PROPOSERS, RECEIVERS);
        SolveOptions options = SolveOptions.builder()
                .weight(1.0)
                .enforceExactlyOne(true)
                .forcedPairs(List.of(MatchPair.of("p", "y")))
                .build();
        FormulatedModel formulated = strategy.formulate(profile, options);

        Matching matching = formulated.decode(backend.solve(formulated.getModel(), Duration.ofSeconds(1)));

        assertEquals(Matching.of(MatchPair.of("p", "y"), MatchPair.of("q", "x")), matching);
    }
}
