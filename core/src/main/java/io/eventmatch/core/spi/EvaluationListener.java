package io.eventmatch.core.spi;

import io.eventmatch.core.error.RuleEvaluationException.Stage;

/**
 * SPI for observability hooks around rule evaluation.
 *
 * <p>
 * Hosts provide implementations that bridge to their metrics or tracing systems; the core has no
 * telemetry dependency. Implementations MUST be thread-safe and non-blocking. Exceptions thrown by
 * listeners are caught and logged: they never change a verdict.
 */
public interface EvaluationListener {

    /**
     * Called when an expression produced a verdict.
     *
     * @param event contains expression, verdict, durationNanos
     */
    void onEvaluationCompleted(EvaluationCompletedEvent event);

    /**
     * Called when any pipeline stage failed.
     *
     * @param event contains expression, stage, errorDetail, durationNanos
     */
    void onEvaluationFailed(EvaluationFailedEvent event);

    /** Event emitted when an evaluation produced a verdict. */
    record EvaluationCompletedEvent(String expression, boolean matched, long durationNanos) {}

    /** Event emitted when an evaluation failed. */
    record EvaluationFailedEvent(String expression, Stage stage, String errorDetail, long durationNanos) {}
}
