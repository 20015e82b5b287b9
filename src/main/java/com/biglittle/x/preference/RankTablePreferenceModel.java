package com.biglittle.x.preference;

import com.biglittle.x.exceptions.InvalidInputException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Rank lookup table shared by every representation. Subclasses only decide what a missing rank means.
 */
public abstract class RankTablePreferenceModel implements PreferenceModel {
    private final ImmutableList<String> owners;
    private final ImmutableList<String> candidates;
    private final ImmutableMap<String, ImmutableMap<String, Integer>> ranks;
    private final int sentinelRank;

    protected RankTablePreferenceModel(List<String> owners, List<String> candidates,
                                       Map<String, PreferenceList> preferences) {
        this.owners = ImmutableList.copyOf(owners);
        this.candidates = ImmutableList.copyOf(candidates);
        this.sentinelRank = candidates.size() + 1;

        ImmutableMap.Builder<String, ImmutableMap<String, Integer>> table = ImmutableMap.builder();
        for (String owner : owners) {
            PreferenceList list = preferences.get(owner);
            table.put(owner, list == null ? ImmutableMap.of() : ImmutableMap.copyOf(list.toRankMap()));
        }
        this.ranks = table.build();
    }

    @Override
    public int rankOf(String participant, String candidate) {
        ImmutableMap<String, Integer> row = ranks.get(participant);
        if (row == null) {
            throw new InvalidInputException("Unknown participant '" + participant + "'");
        }
        Integer rank = row.get(candidate);
        return rank != null ? rank : missingRank(participant, candidate);
    }

    /** Rank reported for a candidate the participant did not rank. */
    protected abstract int missingRank(String participant, String candidate);

    @Override
    public int sentinelRank() {
        return sentinelRank;
    }

    @Override
    public List<String> owners() {
        return owners;
    }

    @Override
    public List<String> candidates() {
        return candidates;
    }

    protected boolean isCandidate(String candidate) {
        return candidates.contains(candidate);
    }
}
