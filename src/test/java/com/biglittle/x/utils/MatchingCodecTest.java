package com.biglittle.x.utils;

import com.biglittle.x.dto.MatchPair;
import com.biglittle.x.dto.Matching;
import com.biglittle.x.dto.MatchingRecords;
import com.biglittle.x.dto.MatchingResult;
import com.biglittle.x.dto.enums.ProblemVariant;
import com.biglittle.x.dto.enums.SolverPath;
import com.biglittle.x.exceptions.InvalidInputException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchingCodecTest {

    @Test
    void roundTripKeepsThePairSetWhateverTheOrder() {
        Matching matching = Matching.of(MatchPair.of("Thomas", "Zora"), MatchPair.of("Ishaan", "Swapneel"),
                MatchPair.of("Cindy", "Kevin"));
        String json = MatchingCodec.serialize(ProblemVariant.TOTAL_ORDER, matching, null);

        Matching reordered = Matching.of(MatchPair.of("Cindy", "Kevin"), MatchPair.of("Thomas", "Zora"),
                MatchPair.of("Ishaan", "Swapneel"));
        assertEquals(reordered, MatchingCodec.toMatching(MatchingCodec.parse(json)));
    }

    @Test
    void documentCarriesVariantAndObjective() {
        MatchingResult result = MatchingResult.builder()
                .variant(ProblemVariant.WEIGHTED_OPTIMIZE)
                .matching(Matching.of(MatchPair.of("p", "x")))
                .objectiveValue(0.75)
                .solverPath(SolverPath.CONSTRAINT_BACKEND)
                .build();

        MatchingRecords.MatchingDocument document = MatchingCodec.parse(MatchingCodec.serialize(result));

        assertEquals("WEIGHTED_OPTIMIZE", document.getVariant());
        assertEquals(ProblemVariant.WEIGHTED_OPTIMIZE, MatchingCodec.variantOf(document));
        assertEquals(0.75, document.getObjectiveValue(), 1e-9);
        assertEquals(1, document.getPairs().size());
    }

    @Test
    void parsesHandWrittenDocument() {
        String json = "{\"variant\":\"PARTIAL_TIES\",\"objectiveValue\":null,"
                + "\"pairs\":[{\"proposer\":\"a\",\"receiver\":\"x\"}],\"extra\":true}";

        Matching matching = MatchingCodec.toMatching(MatchingCodec.parse(json));

        assertTrue(matching.contains("a", "x"));
        assertEquals(1, matching.size());
    }

    @Test
    void emptyMatchingSurvivesTheRoundTrip() {
        String json = MatchingCodec.serialize(ProblemVariant.PARTIAL_TIES, Matching.empty(), null);
        assertTrue(MatchingCodec.toMatching(MatchingCodec.parse(json)).isEmpty());
    }

    @Test
    void malformedDocumentsAreInvalidInput() {
        assertThrows(InvalidInputException.class, () -> MatchingCodec.parse("{not json"));
        assertThrows(InvalidInputException.class, () -> MatchingCodec.parse(""));
        assertThrows(InvalidInputException.class, () -> MatchingCodec.parse("{\"variant\":\"NOPE\",\"pairs\":[]}"));
        assertThrows(InvalidInputException.class, () -> MatchingCodec.parse("{\"pairs\":[]}"));
        assertThrows(InvalidInputException.class,
                () -> MatchingCodec.parse("{\"variant\":\"TOTAL_ORDER\",\"pairs\":[{\"proposer\":\"a\"}]}"));
        assertThrows(InvalidInputException.class,
                () -> MatchingCodec.parse("{\"variant\":\"TOTAL_ORDER\",\"pairs\":null}"));
    }
}
