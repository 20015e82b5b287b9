package com.biglittle.x.utils;

import com.biglittle.x.dto.MatchPair;
import com.biglittle.x.dto.Matching;
import com.biglittle.x.dto.MatchingRecords;
import com.biglittle.x.dto.MatchingResult;
import com.biglittle.x.dto.enums.ProblemVariant;
import com.biglittle.x.exceptions.InvalidInputException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a matching: {@code {"variant", "objectiveValue", "pairs": [{"proposer", "receiver"}]}}.
 */
@Slf4j
@UtilityClass
public class MatchingCodec {
    private static final ObjectMapper om = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static String serialize(ProblemVariant variant, Matching matching, Double objectiveValue) {
        if (variant == null || matching == null) {
            throw new InvalidInputException("Variant and matching are required for serialization");
        }
        List<MatchingRecords.PairRecord> pairs = new ArrayList<>();
        for (MatchPair pair : matching.getPairs()) {
            pairs.add(new MatchingRecords.PairRecord(pair.getProposer(), pair.getReceiver()));
        }
        try {
            return om.writeValueAsString(new MatchingRecords.MatchingDocument(variant.name(), objectiveValue, pairs));
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Failed serializing matching", e);
        }
    }

    public static String serialize(MatchingResult result) {
        return serialize(result.getVariant(), result.getMatching(), result.getObjectiveValue());
    }

    public static MatchingRecords.MatchingDocument parse(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidInputException("Matching document is empty");
        }
        MatchingRecords.MatchingDocument document;
        try {
            document = om.readValue(json, MatchingRecords.MatchingDocument.class);
        } catch (JsonProcessingException e) {
            log.debug("Failed to parse matching document: {}", e.getOriginalMessage());
            throw new InvalidInputException("Malformed matching document: " + e.getOriginalMessage(), e);
        }
        validate(document);
        return document;
    }

    public static Matching toMatching(MatchingRecords.MatchingDocument document) {
        validate(document);
        List<MatchPair> pairs = new ArrayList<>();
        for (MatchingRecords.PairRecord pairRecord : document.getPairs()) {
            pairs.add(MatchPair.of(pairRecord.getProposer(), pairRecord.getReceiver()));
        }
        return Matching.of(pairs);
    }

    public static ProblemVariant variantOf(MatchingRecords.MatchingDocument document) {
        validate(document);
        return ProblemVariant.valueOf(document.getVariant());
    }

    private static void validate(MatchingRecords.MatchingDocument document) {
        if (document == null) {
            throw new InvalidInputException("Matching document is null");
        }
        if (document.getVariant() == null) {
            throw new InvalidInputException("Matching document has no variant");
        }
        try {
            ProblemVariant.valueOf(document.getVariant());
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Unknown variant '" + document.getVariant() + "'", e);
        }
        if (document.getPairs() == null) {
            throw new InvalidInputException("Matching document has no pairs array");
        }
        for (MatchingRecords.PairRecord pairRecord : document.getPairs()) {
            if (pairRecord == null || pairRecord.getProposer() == null || pairRecord.getReceiver() == null) {
                throw new InvalidInputException("Matching document contains an incomplete pair " + pairRecord);
            }
        }
    }
}
