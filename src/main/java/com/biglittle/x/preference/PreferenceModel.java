package com.biglittle.x.preference;

import java.util.List;

/**
 * Uniform query surface over one side's preferences, whatever representation they came from.
 * <p>
 * Ranks are positive, lower is better. {@link #sentinelRank()} stands for "unranked / unacceptable"
 * and is worse than every real rank.
 * </p>
 */
public interface PreferenceModel {

    int rankOf(String participant, String candidate);

    int sentinelRank();

    /** Participants owning a list on this side, in input order. */
    List<String> owners();

    /** Candidates of the opposite side, in input order. */
    List<String> candidates();

    default boolean prefersOrEqual(String participant, String a, String b) {
        return rankOf(participant, a) <= rankOf(participant, b);
    }

    default boolean prefersStrictly(String participant, String a, String b) {
        return rankOf(participant, a) < rankOf(participant, b);
    }

    default boolean isAcceptable(String participant, String candidate) {
        return rankOf(participant, candidate) != sentinelRank();
    }
}
