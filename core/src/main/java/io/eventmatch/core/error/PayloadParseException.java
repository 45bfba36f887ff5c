package io.eventmatch.core.error;

/** Thrown when the event data is not a well-formed JSON object. */
public final class PayloadParseException extends RuleEvaluationException {

    private static final long serialVersionUID = 1L;

    public PayloadParseException(String message) {
        super(message, null, Stage.PARSE);
    }

    public PayloadParseException(String message, Throwable cause) {
        super(message, cause, null, Stage.PARSE);
    }
}
