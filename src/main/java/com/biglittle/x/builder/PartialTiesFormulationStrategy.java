package com.biglittle.x.builder;

import com.biglittle.x.dto.enums.ProblemVariant;
import com.biglittle.x.preference.PreferenceProfile;
import org.springframework.stereotype.Component;

/**
 * Ties and incomplete lists. Only mutually acceptable pairs get a variable, which both keeps the
 * model small and rules out matching anyone to an unacceptable partner.
 */
@Component
public class PartialTiesFormulationStrategy extends StabilityFormulationStrategy {

    @Override
    public boolean supports(ProblemVariant variant) {
        return variant == ProblemVariant.PARTIAL_TIES;
    }

    @Override
    protected boolean includePair(PreferenceProfile profile, String proposer, String receiver) {
        return profile.isMutuallyAcceptable(proposer, receiver);
    }

    @Override
    protected boolean strictComparison() {
        return false;
    }

    @Override
    protected boolean exactlyOne() {
        return false;
    }
}
