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
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Eager input checks. Every rule is applied before a preference model, a constraint model or
 * the deferred acceptance loop is built, so failures never leave partial results behind.
 */
@Slf4j
public final class PreferenceValidator {

    private PreferenceValidator() {
        throw new UnsupportedOperationException("unsupported");
    }

    public static void validateSolveRequest(ProblemVariant variant, List<Participant> proposers, List<Participant> receivers,
                                            Map<String, PreferenceList> proposerPrefs,
                                            Map<String, PreferenceList> receiverPrefs, SolveOptions options) {
        if (variant == null) {
            throw new InvalidInputException("Problem variant is required");
        }
        List<String> proposerIds = validateParticipants("proposer", proposers);
        List<String> receiverIds = validateParticipants("receiver", receivers);

        if (variant.requiresExactlyOne() && proposerIds.size() != receiverIds.size()) {
            throw new InvalidInputException("Variant " + variant + " matches everyone exactly once but there are "
                    + proposerIds.size() + " proposers and " + receiverIds.size() + " receivers");
        }
        validatePreferences(variant, "proposer", proposerIds, receiverIds, proposerPrefs);
        validatePreferences(variant, "receiver", receiverIds, proposerIds, receiverPrefs);
        validateOptions(variant, proposerIds, receiverIds, options);

        if (variant == ProblemVariant.WEIGHTED_OPTIMIZE) {
            validateCapacityFeasibility(proposers, receivers, options);
        }
    }

    public static List<String> validateParticipants(String side, List<Participant> participants) {
        if (participants == null || participants.isEmpty()) {
            throw new InvalidInputException("At least one " + side + " is required");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (Participant participant : participants) {
            if (participant == null || participant.getId() == null || participant.getId().isBlank()) {
                throw new InvalidInputException("Every " + side + " needs a non-blank id");
            }
            if (participant.getCapacity() <= 0) {
                throw new InvalidInputException("Capacity of " + side + " '" + participant.getId()
                        + "' must be positive, got " + participant.getCapacity());
            }
            if (!ids.add(participant.getId())) {
                throw new InvalidInputException("Duplicate " + side + " id '" + participant.getId() + "'");
            }
        }
        return List.copyOf(ids);
    }

    /**
     * Checks one side's lists against the variant: list kinds, duplicates, unknown ids, rank range,
     * empty lists and completeness.
     */
    public static void validatePreferences(ProblemVariant variant, String side, List<String> owners,
                                           List<String> candidates, Map<String, PreferenceList> preferences) {
        if (preferences == null) {
            throw new InvalidInputException("Preferences of every " + side + " are required");
        }
        Set<String> ownerSet = new HashSet<>(owners);
        Set<String> candidateSet = new HashSet<>(candidates);

        for (String key : preferences.keySet()) {
            if (!ownerSet.contains(key)) {
                throw new InvalidInputException("Preferences given for unknown " + side + " '" + key + "'");
            }
        }

        for (String owner : owners) {
            PreferenceList list = preferences.get(owner);
            if (list == null || list.isEmpty()) {
                if (variant.requiresCompleteLists()) {
                    throw new InvalidInputException(side + " '" + owner + "' has an empty preference list but variant "
                            + variant + " requires complete lists");
                }
                continue;
            }
            if (variant == ProblemVariant.TOTAL_ORDER && list.getKind() != PreferenceList.Kind.ORDERED) {
                throw new InvalidInputException(side + " '" + owner + "' must give an ordered list for " + variant);
            }
            if (list.getKind() == PreferenceList.Kind.ORDERED) {
                validateOrderedList(side, owner, list.getOrder(), candidateSet);
            } else {
                validateRankedList(side, owner, list.getRanks(), candidateSet, candidates.size());
            }
            if (variant.requiresCompleteLists()) {
                Map<String, Integer> ranks = list.toRankMap();
                for (String candidate : candidates) {
                    if (!ranks.containsKey(candidate)) {
                        throw new IncompletePreferenceException(owner, candidate);
                    }
                }
            }
        }
    }

    public static void validateOptions(ProblemVariant variant, List<String> proposerIds, List<String> receiverIds,
                                       SolveOptions options) {
        if (options == null) {
            return;
        }
        if (Double.isNaN(options.getWeight()) || options.getWeight() < 0.0 || options.getWeight() > 1.0) {
            throw new InvalidInputException("Weight must lie in [0, 1], got " + options.getWeight());
        }
        if (options.getTimeLimit() != null && (options.getTimeLimit().isNegative() || options.getTimeLimit().isZero())) {
            throw new InvalidInputException("Time limit must be positive, got " + options.getTimeLimit());
        }
        List<MatchPair> forced = options.getForcedPairs() == null ? List.of() : options.getForcedPairs();
        Set<String> proposerSet = new HashSet<>(proposerIds);
        Set<String> receiverSet = new HashSet<>(receiverIds);
        Set<String> forcedProposers = new HashSet<>();
        Set<String> forcedReceivers = new HashSet<>();
        for (MatchPair pair : forced) {
            if (pair == null || !proposerSet.contains(pair.getProposer()) || !receiverSet.contains(pair.getReceiver())) {
                throw new InvalidInputException("Forced pair " + pair + " names an unknown participant");
            }
            if (variant != ProblemVariant.WEIGHTED_OPTIMIZE
                    && (!forcedProposers.add(pair.getProposer()) || !forcedReceivers.add(pair.getReceiver()))) {
                throw new InvalidInputException("Forced pair " + pair + " gives a participant a second partner");
            }
        }
    }

    /**
     * Forced pairs must be mutually acceptable under partial lists.
     */
    public static void validateForcedPairsAcceptable(PreferenceProfile profile, SolveOptions options) {
        if (options == null || options.getForcedPairs() == null
                || profile.getVariant() != ProblemVariant.PARTIAL_TIES) {
            return;
        }
        for (MatchPair pair : options.getForcedPairs()) {
            if (!profile.isMutuallyAcceptable(pair.getProposer(), pair.getReceiver())) {
                throw new InvalidInputException("Forced pair " + pair + " is not mutually acceptable");
            }
        }
    }

    /**
     * On a complete bipartite graph, degree bounds [1, capacity] are satisfiable exactly when each
     * side's total capacity covers the other side.
     */
    public static void validateCapacityFeasibility(List<Participant> proposers, List<Participant> receivers,
                                                   SolveOptions options) {
        boolean exactlyOne = options != null && options.isEnforceExactlyOne();
        if (exactlyOne) {
            if (proposers.size() != receivers.size()) {
                throw new InvalidInputException("Exactly-one matching needs equal sides, got "
                        + proposers.size() + " proposers and " + receivers.size() + " receivers");
            }
            validateForcedPairsWithinCapacity(proposers, receivers, options, true);
            return;
        }
        validateForcedPairsWithinCapacity(proposers, receivers, options, false);
        long proposerCapacity = proposers.stream().mapToLong(Participant::getCapacity).sum();
        long receiverCapacity = receivers.stream().mapToLong(Participant::getCapacity).sum();
        if (proposerCapacity < receivers.size() || receiverCapacity < proposers.size()) {
            log.debug("Capacity check failed: proposerCapacity={}, receivers={}, receiverCapacity={}, proposers={}",
                    proposerCapacity, receivers.size(), receiverCapacity, proposers.size());
            throw new InvalidInputException("Capacities cannot give every participant a match: proposers offer "
                    + proposerCapacity + " slots for " + receivers.size() + " receivers, receivers offer "
                    + receiverCapacity + " slots for " + proposers.size() + " proposers");
        }
    }

    private static void validateForcedPairsWithinCapacity(List<Participant> proposers, List<Participant> receivers,
                                                          SolveOptions options, boolean unitCapacity) {
        if (options == null || options.getForcedPairs() == null || options.getForcedPairs().isEmpty()) {
            return;
        }
        Map<String, Integer> proposerCapacity = new HashMap<>();
        proposers.forEach(p -> proposerCapacity.put(p.getId(), unitCapacity ? 1 : p.getCapacity()));
        Map<String, Integer> receiverCapacity = new HashMap<>();
        receivers.forEach(r -> receiverCapacity.put(r.getId(), unitCapacity ? 1 : r.getCapacity()));

        Map<String, Integer> proposerLoad = new HashMap<>();
        Map<String, Integer> receiverLoad = new HashMap<>();
        for (MatchPair pair : new LinkedHashSet<>(options.getForcedPairs())) {
            int pLoad = proposerLoad.merge(pair.getProposer(), 1, Integer::sum);
            int rLoad = receiverLoad.merge(pair.getReceiver(), 1, Integer::sum);
            if (pLoad > proposerCapacity.getOrDefault(pair.getProposer(), 0)
                    || rLoad > receiverCapacity.getOrDefault(pair.getReceiver(), 0)) {
                throw new InvalidInputException("Forced pair " + pair + " exceeds a participant's capacity");
            }
        }
    }

    public static void validateMatching(PreferenceProfile profile, Matching matching) {
        if (matching == null) {
            throw new InvalidInputException("Matching is required");
        }
        for (MatchPair pair : matching.getPairs()) {
            if (!profile.isProposer(pair.getProposer()) || !profile.isReceiver(pair.getReceiver())) {
                throw new InvalidInputException("Matched pair " + pair + " names an unknown participant");
            }
        }
    }

    private static void validateOrderedList(String side, String owner, List<String> order, Set<String> candidates) {
        Set<String> seen = new HashSet<>();
        for (String candidate : order) {
            if (candidate == null || !candidates.contains(candidate)) {
                throw new InvalidInputException(side + " '" + owner + "' ranks unknown candidate '" + candidate + "'");
            }
            if (!seen.add(candidate)) {
                throw new InvalidInputException(side + " '" + owner + "' lists '" + candidate + "' more than once");
            }
        }
    }

    private static void validateRankedList(String side, String owner, Map<String, Integer> ranks,
                                           Set<String> candidates, int candidateCount) {
        for (Map.Entry<String, Integer> entry : ranks.entrySet()) {
            if (entry.getKey() == null || !candidates.contains(entry.getKey())) {
                throw new InvalidInputException(side + " '" + owner + "' ranks unknown candidate '" + entry.getKey() + "'");
            }
            Integer rank = entry.getValue();
            if (rank == null || rank < 1 || rank > candidateCount) {
                throw new InvalidInputException(side + " '" + owner + "' gives '" + entry.getKey() + "' rank " + rank
                        + ", expected 1.." + candidateCount);
            }
        }
    }
}
