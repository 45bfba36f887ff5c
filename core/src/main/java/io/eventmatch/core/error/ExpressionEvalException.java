package io.eventmatch.core.error;

/**
 * Thrown when a compiled expression fails at runtime (e.g., missing map key, division by zero,
 * a declared variable without a value).
 */
public final class ExpressionEvalException extends RuleEvaluationException {

    private static final long serialVersionUID = 1L;

    public ExpressionEvalException(String message, String expression) {
        super(message, expression, Stage.EVALUATION);
    }

    public ExpressionEvalException(String message, Throwable cause, String expression) {
        super(message, cause, expression, Stage.EVALUATION);
    }
}
