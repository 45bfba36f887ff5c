package io.eventmatch.core.error;

/** Thrown when no event data was supplied at all. */
public final class NilInputException extends RuleEvaluationException {

    private static final long serialVersionUID = 1L;

    public NilInputException(String message) {
        super(message, null, Stage.INPUT);
    }
}
