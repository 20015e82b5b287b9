package com.biglittle.x.service;

import com.biglittle.x.dto.BlockingPair;
import com.biglittle.x.dto.Matching;
import com.biglittle.x.dto.MatchingResult;
import com.biglittle.x.dto.Participant;
import com.biglittle.x.dto.SolveOptions;
import com.biglittle.x.dto.enums.ProblemVariant;
import com.biglittle.x.preference.PreferenceList;

import java.util.List;
import java.util.Map;

public interface MatchingService {
    MatchingResult solve(ProblemVariant variant, List<Participant> proposers, List<Participant> receivers,
                         Map<String, PreferenceList> proposerPrefs, Map<String, PreferenceList> receiverPrefs,
                         SolveOptions options);

    List<BlockingPair> detectInstabilities(Matching matching, Map<String, PreferenceList> proposerPrefs,
                                           Map<String, PreferenceList> receiverPrefs, ProblemVariant variant);

    List<BlockingPair> detectInstabilities(Matching matching, List<Participant> proposers, List<Participant> receivers,
                                           Map<String, PreferenceList> proposerPrefs,
                                           Map<String, PreferenceList> receiverPrefs, ProblemVariant variant);

    Matching deferredAcceptance(Map<String, PreferenceList> proposerPrefs, Map<String, PreferenceList> receiverPrefs);
}
