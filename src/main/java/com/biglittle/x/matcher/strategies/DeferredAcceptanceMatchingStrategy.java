package com.biglittle.x.matcher.strategies;

import com.biglittle.x.dto.MatchPair;
import com.biglittle.x.dto.Matching;
import com.biglittle.x.dto.SolveOptions;
import com.biglittle.x.dto.SolvedMatching;
import com.biglittle.x.dto.enums.ProblemVariant;
import com.biglittle.x.dto.enums.SolverPath;
import com.biglittle.x.exceptions.InvalidInputException;
import com.biglittle.x.preference.PreferenceProfile;
import com.biglittle.x.preference.TotalOrderPreferenceModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Proposer-side deferred acceptance on strict total orders. Produces the proposer-optimal
 * stable matching without touching the constraint backend.
 */
@Slf4j
@Component("deferredAcceptanceMatchingStrategy")
public class DeferredAcceptanceMatchingStrategy implements MatchingStrategy {

    @Override
    public boolean supports(SolverPath path) {
        return path == SolverPath.DEFERRED_ACCEPTANCE;
    }

    @Override
    public SolvedMatching match(PreferenceProfile profile, SolveOptions options) {
        if (options != null && options.getForcedPairs() != null && !options.getForcedPairs().isEmpty()) {
            throw new InvalidInputException("Deferred acceptance cannot honour forced pairs");
        }
        return SolvedMatching.builder()
                .matching(deferredAcceptance(profile))
                .build();
    }

    public Matching deferredAcceptance(PreferenceProfile profile) {
        if (profile.getVariant() != ProblemVariant.TOTAL_ORDER
                || !(profile.getProposerModel() instanceof TotalOrderPreferenceModel proposerModel)) {
            throw new InvalidInputException("Deferred acceptance requires strict total orders, got "
                    + profile.getVariant());
        }
        TotalOrderPreferenceModel receiverModel = (TotalOrderPreferenceModel) profile.getReceiverModel();

        List<String> proposers = profile.proposerIds();
        Deque<String> free = new ArrayDeque<>(proposers);
        Map<String, Integer> cursor = new HashMap<>();
        Map<String, String> heldBy = new HashMap<>();
        long bound = (long) proposers.size() * proposerModel.longestListLength();
        long proposals = 0;

        while (!free.isEmpty()) {
            String proposer = free.poll();
            List<String> order = proposerModel.preferenceOrder(proposer);
            int next = cursor.getOrDefault(proposer, 0);
            if (next >= order.size()) {
                log.debug("Proposer {} exhausted its list after {} proposals", proposer, next);
                continue;
            }
            String receiver = order.get(next);
            cursor.put(proposer, next + 1);
            if (++proposals > bound) {
                throw new IllegalStateException("Deferred acceptance exceeded " + bound + " proposals");
            }

            String held = heldBy.get(receiver);
            if (held == null) {
                heldBy.put(receiver, proposer);
            } else if (receiverModel.rankOf(receiver, proposer) < receiverModel.rankOf(receiver, held)) {
                heldBy.put(receiver, proposer);
                free.add(held);
            } else {
                free.add(proposer);
            }
        }

        Map<String, String> partnerOf = new HashMap<>();
        heldBy.forEach((receiver, proposer) -> partnerOf.put(proposer, receiver));
        List<MatchPair> pairs = new ArrayList<>();
        for (String proposer : proposers) {
            String receiver = partnerOf.get(proposer);
            if (receiver != null) {
                pairs.add(MatchPair.of(proposer, receiver));
            }
        }
        log.debug("Deferred acceptance finished: proposers={}, receivers={}, proposals={}, pairs={}",
                proposers.size(), profile.receiverIds().size(), proposals, pairs.size());
        return Matching.of(pairs);
    }
}
