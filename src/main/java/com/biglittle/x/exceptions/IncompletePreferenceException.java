package com.biglittle.x.exceptions;

import lombok.Getter;

/**
 * Exception thrown when a variant that requires complete preference lists finds a missing rank.
 */
@Getter
public class IncompletePreferenceException extends MatchingException {
    private final String participant;
    private final String candidate;

    public IncompletePreferenceException(String participant, String candidate) {
        super("Participant '" + participant + "' does not rank '" + candidate + "' but complete lists are required");
        this.participant = participant;
        this.candidate = candidate;
    }
}
