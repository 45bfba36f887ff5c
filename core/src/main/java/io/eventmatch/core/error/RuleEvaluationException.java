package io.eventmatch.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Abstract base for all failures of the rule evaluation pipeline. Never thrown directly: each
 * pipeline stage has a concrete subclass. A failure at any stage aborts the pipeline; nothing is
 * retried.
 *
 * <p>
 * {@link #context()} exposes the structured error context (stage, expression and any
 * stage-specific details) for structured error sinks.
 */
public abstract class RuleEvaluationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline stage in which the error occurred. */
    public enum Stage {
        INPUT,
        PARSE,
        ENVIRONMENT,
        COMPILE,
        EVALUATION,
        RESULT
    }

    private final String expression;
    private final Stage stage;

    protected RuleEvaluationException(String message, String expression, Stage stage) {
        super(message);
        this.expression = expression;
        this.stage = stage;
    }

    protected RuleEvaluationException(String message, Throwable cause, String expression, Stage stage) {
        super(message, cause);
        this.expression = expression;
        this.stage = stage;
    }

    /** The expression being evaluated, or {@code null} if the failure precedes it. */
    public String expression() {
        return expression;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The stage in which the error occurred. */
    public Stage stage() {
        return stage;
    }

    /** Structured error context, in insertion order. */
    public Map<String, Object> context() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("stage", stage.name().toLowerCase());
        if (expression != null) {
            context.put("expression", expression);
        }
        contributeContext(context);
        return Collections.unmodifiableMap(context);
    }

    /** Hook for subclasses to add stage-specific context entries. */
    protected void contributeContext(Map<String, Object> context) {}
}
