package com.biglittle.x.processors;

import com.biglittle.x.preference.PreferenceModel;
import com.biglittle.x.preference.PreferenceProfile;
import com.biglittle.x.service.ScoreCalculator;
import org.springframework.stereotype.Component;

/**
 * Blends both sides' rank quality: {@code weight * q(proposer's rank) + (1 - weight) * q(receiver's rank)}.
 * <p>
 * {@code q} is linear in the rank, 1.0 for the best rank and 0.0 for the sentinel.
 * </p>
 */
@Component
public class WeightedScoreCalculator implements ScoreCalculator {

    @Override
    public double calculate(PreferenceProfile profile, String proposer, String receiver, double weight) {
        PreferenceModel proposerModel = profile.getProposerModel();
        PreferenceModel receiverModel = profile.getReceiverModel();
        double proposerQuality = rankQuality(proposerModel.rankOf(proposer, receiver), proposerModel.sentinelRank());
        double receiverQuality = rankQuality(receiverModel.rankOf(receiver, proposer), receiverModel.sentinelRank());
        return weight * proposerQuality + (1 - weight) * receiverQuality;
    }

    public static double rankQuality(int rank, int sentinelRank) {
        if (sentinelRank <= 1) {
            return 0.0;
        }
        int bounded = Math.max(1, Math.min(rank, sentinelRank));
        return (double) (sentinelRank - bounded) / (sentinelRank - 1);
    }
}
