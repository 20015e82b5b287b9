package com.biglittle.x.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A proposer and a receiver, not matched to each other, who both strictly prefer each other
 * to their current assignment.
 */
@Data
@AllArgsConstructor(staticName = "of")
public class BlockingPair {
    private final String proposer;
    private final String receiver;
    private final int proposerRankOfReceiver;
    private final int receiverRankOfProposer;
}
