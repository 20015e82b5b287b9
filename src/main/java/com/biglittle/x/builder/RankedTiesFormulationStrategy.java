package com.biglittle.x.builder;

import com.biglittle.x.dto.enums.ProblemVariant;
import com.biglittle.x.preference.PreferenceProfile;
import org.springframework.stereotype.Component;

/**
 * Complete lists with ties. A participant matched to an equally ranked candidate cannot block,
 * so the comparison is weak.
 */
@Component
public class RankedTiesFormulationStrategy extends StabilityFormulationStrategy {

    @Override
    public boolean supports(ProblemVariant variant) {
        return variant == ProblemVariant.RANKED_TIES;
    }

    @Override
    protected boolean includePair(PreferenceProfile profile, String proposer, String receiver) {
        return true;
    }

    @Override
    protected boolean strictComparison() {
        return false;
    }

    @Override
    protected boolean exactlyOne() {
        return true;
    }
}
