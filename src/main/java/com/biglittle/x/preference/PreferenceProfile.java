package com.biglittle.x.preference;

import com.biglittle.x.dto.Participant;
import com.biglittle.x.dto.enums.ProblemVariant;
import com.biglittle.x.exceptions.InvalidInputException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Everything one solve reads: both sides, their capacities and their preference models.
 * <p>
 * Declared capacities only apply to {@link ProblemVariant#WEIGHTED_OPTIMIZE} without the exactly-one
 * option. Every other profile reports a capacity of 1 for everyone.
 * </p>
 */
@Getter
public final class PreferenceProfile {
    private final ProblemVariant variant;
    private final ImmutableList<Participant> proposers;
    private final ImmutableList<Participant> receivers;
    private final PreferenceModel proposerModel;
    private final PreferenceModel receiverModel;
    private final ImmutableMap<String, Participant> proposersById;
    private final ImmutableMap<String, Participant> receiversById;
    private final boolean unitCapacity;

    private PreferenceProfile(ProblemVariant variant, List<Participant> proposers, List<Participant> receivers,
                              PreferenceModel proposerModel, PreferenceModel receiverModel, boolean unitCapacity) {
        this.variant = variant;
        this.unitCapacity = unitCapacity;
        this.proposers = ImmutableList.copyOf(proposers);
        this.receivers = ImmutableList.copyOf(receivers);
        this.proposerModel = proposerModel;
        this.receiverModel = receiverModel;
        this.proposersById = this.proposers.stream()
                .collect(ImmutableMap.toImmutableMap(Participant::getId, Function.identity()));
        this.receiversById = this.receivers.stream()
                .collect(ImmutableMap.toImmutableMap(Participant::getId, Function.identity()));
    }

    public static PreferenceProfile of(ProblemVariant variant, List<Participant> proposers, List<Participant> receivers,
                                       Map<String, PreferenceList> proposerPrefs,
                                       Map<String, PreferenceList> receiverPrefs) {
        List<String> proposerIds = proposers.stream().map(Participant::getId).toList();
        List<String> receiverIds = receivers.stream().map(Participant::getId).toList();
        return new PreferenceProfile(variant, proposers, receivers,
                PreferenceModels.create(variant, proposerIds, receiverIds, proposerPrefs),
                PreferenceModels.create(variant, receiverIds, proposerIds, receiverPrefs),
                variant != ProblemVariant.WEIGHTED_OPTIMIZE);
    }

    /** Same lists, everyone capped at one partner. */
    public PreferenceProfile withUnitCapacity() {
        if (unitCapacity) {
            return this;
        }
        return new PreferenceProfile(variant, proposers, receivers, proposerModel, receiverModel, true);
    }

    public List<String> proposerIds() {
        return proposerModel.owners();
    }

    public List<String> receiverIds() {
        return receiverModel.owners();
    }

    public int proposerCapacity(String proposer) {
        int capacity = require(proposersById, proposer, "proposer").getCapacity();
        return unitCapacity ? 1 : capacity;
    }

    public int receiverCapacity(String receiver) {
        int capacity = require(receiversById, receiver, "receiver").getCapacity();
        return unitCapacity ? 1 : capacity;
    }

    public boolean isProposer(String id) {
        return proposersById.containsKey(id);
    }

    public boolean isReceiver(String id) {
        return receiversById.containsKey(id);
    }

    /** Both sides rank each other with a real rank. */
    public boolean isMutuallyAcceptable(String proposer, String receiver) {
        return proposerModel.isAcceptable(proposer, receiver) && receiverModel.isAcceptable(receiver, proposer);
    }

    private static Participant require(Map<String, Participant> side, String id, String label) {
        Participant participant = side.get(id);
        if (participant == null) {
            throw new InvalidInputException("Unknown " + label + " '" + id + "'");
        }
        return participant;
    }
}
