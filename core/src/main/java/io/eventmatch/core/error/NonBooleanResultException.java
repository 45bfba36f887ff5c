package io.eventmatch.core.error;

import io.eventmatch.core.model.ValueKind;
import java.util.Map;

/** Thrown when an expression evaluates successfully but not to a boolean. */
public final class NonBooleanResultException extends RuleEvaluationException {

    private static final long serialVersionUID = 1L;

    private final ValueKind resultKind;

    public NonBooleanResultException(ValueKind resultKind, String expression) {
        super("output type is not boolean: " + resultKind.displayName(), expression, Stage.RESULT);
        this.resultKind = resultKind;
    }

    /** The kind the expression actually produced. */
    public ValueKind resultKind() {
        return resultKind;
    }

    @Override
    protected void contributeContext(Map<String, Object> context) {
        context.put("result_kind", resultKind.displayName());
    }
}
