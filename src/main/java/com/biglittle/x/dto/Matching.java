package com.biglittle.x.dto;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collection;
import java.util.List;

/**
 * Immutable set of proposer/receiver pairs. Iteration follows insertion order, equality ignores it.
 */
@Getter
@EqualsAndHashCode
public final class Matching {
    private static final Matching EMPTY = new Matching(ImmutableSet.of());

    private final ImmutableSet<MatchPair> pairs;

    private Matching(ImmutableSet<MatchPair> pairs) {
        this.pairs = pairs;
    }

    public static Matching of(Collection<MatchPair> pairs) {
        return pairs.isEmpty() ? EMPTY : new Matching(ImmutableSet.copyOf(pairs));
    }

    public static Matching of(MatchPair... pairs) {
        return of(List.of(pairs));
    }

    public static Matching empty() {
        return EMPTY;
    }

    public int size() {
        return pairs.size();
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    public boolean contains(String proposer, String receiver) {
        return pairs.contains(MatchPair.of(proposer, receiver));
    }

    public List<String> partnersOfProposer(String proposer) {
        return pairs.stream()
                .filter(pair -> pair.getProposer().equals(proposer))
                .map(MatchPair::getReceiver)
                .collect(ImmutableList.toImmutableList());
    }

    public List<String> partnersOfReceiver(String receiver) {
        return pairs.stream()
                .filter(pair -> pair.getReceiver().equals(receiver))
                .map(MatchPair::getProposer)
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public String toString() {
        return pairs.toString();
    }
}
