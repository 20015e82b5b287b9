package com.biglittle.x.matcher.strategies;

import com.biglittle.x.dto.SolveOptions;
import com.biglittle.x.dto.SolvedMatching;
import com.biglittle.x.dto.enums.SolverPath;
import com.biglittle.x.preference.PreferenceProfile;

public interface MatchingStrategy {
    SolvedMatching match(PreferenceProfile profile, SolveOptions options);
    boolean supports(SolverPath path);
}
