package com.biglittle.x.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor(staticName = "of")
public class MatchPair {
    private final String proposer;
    private final String receiver;

    @Override
    public String toString() {
        return "(" + proposer + ", " + receiver + ")";
    }
}
