package com.biglittle.x.preference;

import com.biglittle.x.dto.enums.ProblemVariant;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Map;

@UtilityClass
public class PreferenceModels {

    /**
     * Picks the representation for a variant. Input is expected to have passed
     * {@link com.biglittle.x.validation.PreferenceValidator} already.
     */
    public static PreferenceModel create(ProblemVariant variant, List<String> owners, List<String> candidates,
                                         Map<String, PreferenceList> preferences) {
        return switch (variant) {
            case TOTAL_ORDER -> new TotalOrderPreferenceModel(owners, candidates, preferences);
            case RANKED_TIES -> new TiedPreferenceModel(owners, candidates, preferences);
            case PARTIAL_TIES, WEIGHTED_OPTIMIZE -> new PartialPreferenceModel(owners, candidates, preferences);
        };
    }
}
