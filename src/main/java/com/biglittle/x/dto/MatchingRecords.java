package com.biglittle.x.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serial;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Wire representation of a matching: the only durable artifact of the core.
 */
public interface MatchingRecords {

    @AllArgsConstructor
    @NoArgsConstructor
    @Data
    class PairRecord implements Serializable {
        @Serial
        private static final long serialVersionUID = 1L;
        private String proposer;
        private String receiver;
    }

    @AllArgsConstructor
    @NoArgsConstructor
    @Data
    class MatchingDocument implements Serializable {
        @Serial
        private static final long serialVersionUID = 1L;
        private String variant;
        private Double objectiveValue;
        private List<PairRecord> pairs = new ArrayList<>();
    }
}
