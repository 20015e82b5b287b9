package com.biglittle.x.validation;

import com.biglittle.x.dto.MatchPair;
import com.biglittle.x.dto.Matching;
import com.biglittle.x.dto.Participant;
import com.biglittle.x.dto.SolveOptions;
import com.biglittle.x.dto.enums.ProblemVariant;
import com.biglittle.x.exceptions.IncompletePreferenceException;
import com.biglittle.x.exceptions.InvalidInputException;
import com.biglittle.x.preference.PreferenceList;
import com.biglittle.x.preference.PreferenceProfile;
import com.biglittle.x.support.Scenarios;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.biglittle.x.support.Scenarios.participants;
import static com.biglittle.x.support.Scenarios.prefs;
import static com.biglittle.x.support.Scenarios.ranks;
import static org.junit.jupiter.api.Assertions.*;

class PreferenceValidatorTest {
    private static final List<Participant> BIGS = participants(Scenarios.BIGS);
    private static final List<Participant> LITTLES = participants(Scenarios.LITTLES);

    @Test
    void acceptsTheReferenceScenario() {
        assertDoesNotThrow(() -> PreferenceValidator.validateSolveRequest(ProblemVariant.TOTAL_ORDER, BIGS, LITTLES,
                Scenarios.bigPrefs(), Scenarios.littlePrefs(), SolveOptions.defaults()));
    }

    @Test
    void rejectsDuplicateParticipantIds() {
        List<Participant> duplicated = List.of(Participant.of("a"), Participant.of("a"));
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> PreferenceValidator.validateParticipants("proposer", duplicated));
        assertTrue(e.getMessage().contains("'a'"));
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(InvalidInputException.class,
                () -> PreferenceValidator.validateParticipants("receiver", List.of(Participant.of("x", 0))));
    }

    @Test
    void rejectsDuplicateEntriesInOrderedList() {
        Map<String, PreferenceList> lists = prefs("p", PreferenceList.ordered("x", "x"));
        assertThrows(InvalidInputException.class, () -> PreferenceValidator.validatePreferences(
                ProblemVariant.PARTIAL_TIES, "proposer", List.of("p"), List.of("x", "y"), lists));
    }

    @Test
    void rejectsUnknownCandidate() {
        Map<String, PreferenceList> lists = prefs("p", PreferenceList.ordered("x", "ghost"));
        InvalidInputException e = assertThrows(InvalidInputException.class, () -> PreferenceValidator.validatePreferences(
                ProblemVariant.PARTIAL_TIES, "proposer", List.of("p"), List.of("x", "y"), lists));
        assertTrue(e.getMessage().contains("ghost"));
    }

    @Test
    void rejectsRankOutsideRange() {
        Map<String, PreferenceList> lists = prefs("p", PreferenceList.ranked(ranks("x", 0, "y", 1)));
        assertThrows(InvalidInputException.class, () -> PreferenceValidator.validatePreferences(
                ProblemVariant.RANKED_TIES, "proposer", List.of("p"), List.of("x", "y"), lists));
    }

    @Test
    void rejectsRankedListForTotalOrder() {
        Map<String, PreferenceList> lists = prefs("p", PreferenceList.ranked(ranks("x", 1, "y", 2)));
        assertThrows(InvalidInputException.class, () -> PreferenceValidator.validatePreferences(
                ProblemVariant.TOTAL_ORDER, "proposer", List.of("p"), List.of("x", "y"), lists));
    }

    @Test
    void reportsIncompleteListUnderCompleteVariant() {
        Map<String, PreferenceList> lists = prefs("p", PreferenceList.ordered("x"));
        IncompletePreferenceException e = assertThrows(IncompletePreferenceException.class,
                () -> PreferenceValidator.validatePreferences(
                        ProblemVariant.TOTAL_ORDER, "proposer", List.of("p"), List.of("x", "y"), lists));
        assertEquals("p", e.getParticipant());
        assertEquals("y", e.getCandidate());
    }

    @Test
    void rejectsEmptyListUnderCompleteVariant() {
        Map<String, PreferenceList> lists = prefs("p", PreferenceList.empty());
        assertThrows(InvalidInputException.class, () -> PreferenceValidator.validatePreferences(
                ProblemVariant.RANKED_TIES, "proposer", List.of("p"), List.of("x"), lists));
    }

    @Test
    void allowsEmptyListUnderPartialVariant() {
        Map<String, PreferenceList> lists = prefs("p", PreferenceList.empty());
        assertDoesNotThrow(() -> PreferenceValidator.validatePreferences(
                ProblemVariant.PARTIAL_TIES, "proposer", List.of("p"), List.of("x"), lists));
    }

    @Test
    void rejectsPreferencesOfUnknownOwner() {
        Map<String, PreferenceList> lists = prefs("stranger", PreferenceList.ordered("x"));
        assertThrows(InvalidInputException.class, () -> PreferenceValidator.validatePreferences(
                ProblemVariant.PARTIAL_TIES, "proposer", List.of("p"), List.of("x"), lists));
    }

    @Test
    void rejectsSizeMismatchForExactlyOneVariants() {
        List<Participant> twoLittles = participants(List.of("Swapneel", "Zora"));
        assertThrows(InvalidInputException.class, () -> PreferenceValidator.validateSolveRequest(
                ProblemVariant.RANKED_TIES, BIGS, twoLittles, Scenarios.bigPrefs(), Map.of(), SolveOptions.defaults()));
    }

    @Test
    void rejectsWeightOutsideUnitInterval() {
        SolveOptions options = SolveOptions.builder().weight(1.5).build();
        assertThrows(InvalidInputException.class, () -> PreferenceValidator.validateOptions(
                ProblemVariant.WEIGHTED_OPTIMIZE, Scenarios.BIGS, Scenarios.LITTLES, options));
    }

    @Test
    void rejectsNonPositiveTimeLimit() {
        SolveOptions options = SolveOptions.builder().timeLimit(Duration.ZERO).build();
        assertThrows(InvalidInputException.class, () -> PreferenceValidator.validateOptions(
                ProblemVariant.TOTAL_ORDER, Scenarios.BIGS, Scenarios.LITTLES, options));
    }

    @Test
    void rejectsForcedPairWithUnknownParticipant() {
        SolveOptions options = SolveOptions.builder().forcedPairs(List.of(MatchPair.of("Ishaan", "Nobody"))).build();
        assertThrows(InvalidInputException.class, () -> PreferenceValidator.validateOptions(
                ProblemVariant.TOTAL_ORDER, Scenarios.BIGS, Scenarios.LITTLES, options));
    }

    @Test
    void rejectsForcedPairsSharingAParticipantUnlessWeighted() {
        SolveOptions options = SolveOptions.builder()
                .forcedPairs(List.of(MatchPair.of("Ishaan", "Kevin"), MatchPair.of("Ishaan", "Zora")))
                .build();
        assertThrows(InvalidInputException.class, () -> PreferenceValidator.validateOptions(
                ProblemVariant.RANKED_TIES, Scenarios.BIGS, Scenarios.LITTLES, options));
        assertDoesNotThrow(() -> PreferenceValidator.validateOptions(
                ProblemVariant.WEIGHTED_OPTIMIZE, Scenarios.BIGS, Scenarios.LITTLES, options));
    }

    @Test
    void rejectsForcedPairThatIsNotMutuallyAcceptable() {
        PreferenceProfile profile = PreferenceProfile.of(ProblemVariant.PARTIAL_TIES, BIGS, LITTLES,
                Scenarios.partialBigPrefs(), Scenarios.littlePrefs());
        SolveOptions options = SolveOptions.builder().forcedPairs(List.of(MatchPair.of("Ishaan", "Kevin"))).build();

        assertThrows(InvalidInputException.class,
                () -> PreferenceValidator.validateForcedPairsAcceptable(profile, options));
    }

    @Test
    void capacityCheckNeedsBothSidesCovered() {
        List<Participant> oneBig = List.of(Participant.of("big", 2));
        List<Participant> threeLittles = participants(List.of("x", "y", "z"));

        assertThrows(InvalidInputException.class,
                () -> PreferenceValidator.validateCapacityFeasibility(oneBig, threeLittles, SolveOptions.defaults()));
        assertDoesNotThrow(() -> PreferenceValidator.validateCapacityFeasibility(
                List.of(Participant.of("big", 3)), threeLittles, SolveOptions.defaults()));
    }

    @Test
    void exactlyOneCapacityCheckNeedsEqualSides() {
        SolveOptions exactlyOne = SolveOptions.builder().enforceExactlyOne(true).build();
        assertThrows(InvalidInputException.class, () -> PreferenceValidator.validateCapacityFeasibility(
                List.of(Participant.of("big", 3)), participants(List.of("x", "y")), exactlyOne));
    }

    @Test
    void forcedPairsMustFitWithinCapacities() {
        List<Participant> bigs = List.of(Participant.of("A", 1), Participant.of("B", 2));
        List<Participant> littles = participants(List.of("x", "y"));
        SolveOptions overA = SolveOptions.builder()
                .forcedPairs(List.of(MatchPair.of("A", "x"), MatchPair.of("A", "y")))
                .build();
        SolveOptions withinB = SolveOptions.builder()
                .forcedPairs(List.of(MatchPair.of("B", "x"), MatchPair.of("B", "y")))
                .build();

        assertThrows(InvalidInputException.class,
                () -> PreferenceValidator.validateCapacityFeasibility(bigs, littles, overA));
        assertDoesNotThrow(() -> PreferenceValidator.validateCapacityFeasibility(bigs, littles, withinB));
        assertThrows(InvalidInputException.class, () -> PreferenceValidator.validateCapacityFeasibility(
                List.of(Participant.of("A", 1), Participant.of("B", 2)), littles,
                withinB.toBuilder().enforceExactlyOne(true).build()));
    }

    @Test
    void rejectsMatchingWithUnknownParticipant() {
        PreferenceProfile profile = PreferenceProfile.of(ProblemVariant.TOTAL_ORDER, BIGS, LITTLES,
                Scenarios.bigPrefs(), Scenarios.littlePrefs());
        assertThrows(InvalidInputException.class, () -> PreferenceValidator.validateMatching(profile,
                Matching.of(MatchPair.of("Kevin", "Ishaan"))));
    }
}
