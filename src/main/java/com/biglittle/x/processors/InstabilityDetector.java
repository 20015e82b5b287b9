package com.biglittle.x.processors;

import com.biglittle.x.dto.BlockingPair;
import com.biglittle.x.dto.Matching;
import com.biglittle.x.preference.PreferenceModel;
import com.biglittle.x.preference.PreferenceProfile;
import com.biglittle.x.validation.PreferenceValidator;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Enumerates blocking pairs of a matching through the {@link PreferenceModel} query surface only.
 * <p>
 * A pair blocks when both sides strictly improve. The test is strict for every variant, including the
 * ones whose stability constraint compares weakly. An unmatched participant, or one with free capacity,
 * wants every acceptable candidate; a participant at capacity only wants candidates it strictly prefers
 * to its worst partner. Capacities come from the profile, so one-to-one profiles cap everyone at 1.
 * </p>
 */
@Slf4j
@Component
public class InstabilityDetector {

    public List<BlockingPair> detect(PreferenceProfile profile, Matching matching) {
        PreferenceValidator.validateMatching(profile, matching);
        PreferenceModel proposerModel = profile.getProposerModel();
        PreferenceModel receiverModel = profile.getReceiverModel();

        Map<String, Optional<String>> receiverThresholds = new HashMap<>();
        for (String receiver : profile.receiverIds()) {
            receiverThresholds.put(receiver, threshold(receiverModel, receiver, matching.partnersOfReceiver(receiver),
                    profile.receiverCapacity(receiver)));
        }

        List<BlockingPair> blocking = new ArrayList<>();
        for (String proposer : profile.proposerIds()) {
            List<String> partners = matching.partnersOfProposer(proposer);
            Optional<String> proposerThreshold = threshold(proposerModel, proposer, partners, profile.proposerCapacity(proposer));

            for (String receiver : profile.receiverIds()) {
                if (partners.contains(receiver)
                        || !wants(proposerModel, proposer, receiver, proposerThreshold)
                        || !wants(receiverModel, receiver, proposer, receiverThresholds.get(receiver))) {
                    continue;
                }
                blocking.add(BlockingPair.of(proposer, receiver,
                        proposerModel.rankOf(proposer, receiver), receiverModel.rankOf(receiver, proposer)));
            }
        }

        if (!blocking.isEmpty()) {
            log.debug("Found {} blocking pairs for variant={}, matchingSize={}", blocking.size(),
                    profile.getVariant(), matching.size());
        }
        return ImmutableList.copyOf(blocking);
    }

    /** Worst current partner when at capacity, empty while a slot is free. */
    private static Optional<String> threshold(PreferenceModel model, String participant, List<String> partners,
                                              int capacity) {
        if (partners.size() < capacity) {
            return Optional.empty();
        }
        String worst = partners.get(0);
        for (String partner : partners) {
            if (model.prefersStrictly(participant, worst, partner)) {
                worst = partner;
            }
        }
        return Optional.of(worst);
    }

    private static boolean wants(PreferenceModel model, String participant, String candidate, Optional<String> threshold) {
        if (!model.isAcceptable(participant, candidate)) {
            return false;
        }
        return threshold.map(worst -> model.prefersStrictly(participant, candidate, worst)).orElse(true);
    }
}
