package com.biglittle.x.preference;

import com.biglittle.x.exceptions.IncompletePreferenceException;
import com.biglittle.x.exceptions.InvalidInputException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Strict total orders: rank is the list position. Keeps the lists themselves for deferred acceptance.
 */
public final class TotalOrderPreferenceModel extends RankTablePreferenceModel {
    private final ImmutableMap<String, ImmutableList<String>> orders;

    TotalOrderPreferenceModel(List<String> owners, List<String> candidates, Map<String, PreferenceList> preferences) {
        super(owners, candidates, preferences);
        ImmutableMap.Builder<String, ImmutableList<String>> builder = ImmutableMap.builder();
        for (String owner : owners) {
            PreferenceList list = preferences.get(owner);
            builder.put(owner, list == null ? ImmutableList.of() : ImmutableList.copyOf(list.getOrder()));
        }
        this.orders = builder.build();
    }

    public List<String> preferenceOrder(String participant) {
        ImmutableList<String> order = orders.get(participant);
        if (order == null) {
            throw new InvalidInputException("Unknown participant '" + participant + "'");
        }
        return order;
    }

    public int longestListLength() {
        return orders.values().stream().mapToInt(List::size).max().orElse(0);
    }

    @Override
    protected int missingRank(String participant, String candidate) {
        if (!isCandidate(candidate)) {
            throw new InvalidInputException("Unknown candidate '" + candidate + "' for '" + participant + "'");
        }
        throw new IncompletePreferenceException(participant, candidate);
    }
}
