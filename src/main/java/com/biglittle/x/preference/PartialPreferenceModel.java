package com.biglittle.x.preference;

import com.biglittle.x.exceptions.InvalidInputException;

import java.util.List;
import java.util.Map;

/**
 * Partial rankings with ties. An absent candidate is unacceptable and gets the sentinel rank.
 */
public final class PartialPreferenceModel extends RankTablePreferenceModel {

    PartialPreferenceModel(List<String> owners, List<String> candidates, Map<String, PreferenceList> preferences) {
        super(owners, candidates, preferences);
    }

    @Override
    protected int missingRank(String participant, String candidate) {
        if (!isCandidate(candidate)) {
            throw new InvalidInputException("Unknown candidate '" + candidate + "' for '" + participant + "'");
        }
        return sentinelRank();
    }
}
