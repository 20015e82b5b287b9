package com.biglittle.x.builder;

import com.biglittle.x.dto.enums.ProblemVariant;
import com.biglittle.x.preference.PreferenceProfile;
import org.springframework.stereotype.Component;

@Component
public class TotalOrderFormulationStrategy extends StabilityFormulationStrategy {

    @Override
    public boolean supports(ProblemVariant variant) {
        return variant == ProblemVariant.TOTAL_ORDER;
    }

    @Override
    protected boolean includePair(PreferenceProfile profile, String proposer, String receiver) {
        return true;
    }

    @Override
    protected boolean strictComparison() {
        return true;
    }

    @Override
    protected boolean exactlyOne() {
        return true;
    }
}
