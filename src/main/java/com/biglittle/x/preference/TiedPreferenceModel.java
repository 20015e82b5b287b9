package com.biglittle.x.preference;

import com.biglittle.x.exceptions.IncompletePreferenceException;
import com.biglittle.x.exceptions.InvalidInputException;

import java.util.List;
import java.util.Map;

/**
 * Complete rankings with ties. Every participant ranks the whole opposite side.
 */
public final class TiedPreferenceModel extends RankTablePreferenceModel {

    TiedPreferenceModel(List<String> owners, List<String> candidates, Map<String, PreferenceList> preferences) {
        super(owners, candidates, preferences);
    }

    @Override
    protected int missingRank(String participant, String candidate) {
        if (!isCandidate(candidate)) {
            throw new InvalidInputException("Unknown candidate '" + candidate + "' for '" + participant + "'");
        }
        throw new IncompletePreferenceException(participant, candidate);
    }
}
