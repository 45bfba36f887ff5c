package io.eventmatch.core.error;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thrown when an expression fails to parse or type-check against its environment. Carries every
 * issue found, not just the first one.
 */
public final class ExpressionCompileException extends RuleEvaluationException {

    private static final long serialVersionUID = 1L;

    private final List<CompileIssue> issues;

    public ExpressionCompileException(String expression, List<CompileIssue> issues) {
        super("failed to compile expression: " + describe(issues), expression, Stage.COMPILE);
        this.issues = List.copyOf(issues);
    }

    public ExpressionCompileException(String expression, List<CompileIssue> issues, Throwable cause) {
        super("failed to compile expression: " + describe(issues), cause, expression, Stage.COMPILE);
        this.issues = List.copyOf(issues);
    }

    /** All issues reported by the compiler, in source order. */
    public List<CompileIssue> issues() {
        return issues;
    }

    @Override
    protected void contributeContext(Map<String, Object> context) {
        context.put("issues", issues.stream().map(CompileIssue::toString).collect(Collectors.toList()));
    }

    private static String describe(List<CompileIssue> issues) {
        return issues.stream().map(CompileIssue::toString).collect(Collectors.joining("; "));
    }
}
