package com.biglittle.x.preference;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw preferences of one participant, either an ordered list (first is best) or a rank map
 * (lower is better, equal ranks are ties).
 * <p>
 * Entries are kept exactly as supplied; duplicates, unknown ids and illegal ranks are reported
 * by {@link com.biglittle.x.validation.PreferenceValidator} rather than silently dropped here.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class PreferenceList {

    public enum Kind {
        ORDERED,
        RANKED
    }

    private final Kind kind;
    private final List<String> order;
    private final Map<String, Integer> ranks;

    public static PreferenceList ordered(String... candidates) {
        return ordered(Arrays.asList(candidates));
    }

    public static PreferenceList ordered(List<String> candidates) {
        return new PreferenceList(Kind.ORDERED, Collections.unmodifiableList(new ArrayList<>(candidates)), Map.of());
    }

    public static PreferenceList ranked(Map<String, Integer> ranks) {
        return new PreferenceList(Kind.RANKED, List.of(), Collections.unmodifiableMap(new LinkedHashMap<>(ranks)));
    }

    public static PreferenceList empty() {
        return ordered(List.of());
    }

    public boolean isEmpty() {
        return kind == Kind.ORDERED ? order.isEmpty() : ranks.isEmpty();
    }

    public int size() {
        return kind == Kind.ORDERED ? order.size() : ranks.size();
    }

    /**
     * Candidate to rank map; ordered lists rank by position starting at 1.
     */
    public Map<String, Integer> toRankMap() {
        if (kind == Kind.RANKED) {
            return ranks;
        }
        Map<String, Integer> result = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            result.putIfAbsent(order.get(i), i + 1);
        }
        return result;
    }
}
