package com.biglittle.x.service;

import com.biglittle.x.preference.PreferenceProfile;

public interface ScoreCalculator {
    double calculate(PreferenceProfile profile, String proposer, String receiver, double weight);
}
