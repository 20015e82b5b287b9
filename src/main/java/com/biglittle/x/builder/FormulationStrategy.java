package com.biglittle.x.builder;

import com.biglittle.x.dto.SolveOptions;
import com.biglittle.x.dto.enums.ProblemVariant;
import com.biglittle.x.preference.PreferenceProfile;

public interface FormulationStrategy {
    FormulatedModel formulate(PreferenceProfile profile, SolveOptions options);
    boolean supports(ProblemVariant variant);
}
