package com.biglittle.x.exceptions;

import com.biglittle.x.dto.enums.ProblemVariant;
import lombok.Getter;

/**
 * Exception thrown when the constraint backend proves that no stable matching satisfies the model.
 * <p>
 * This is an expected outcome (for example when forced pairs rule out every stable matching),
 * not a defect of the backend.
 * </p>
 */
@Getter
public class NoStableMatchingException extends MatchingException {
    private final ProblemVariant variant;

    public NoStableMatchingException(ProblemVariant variant, String message) {
        super(message);
        this.variant = variant;
    }
}
