package io.eventmatch.core.engine;

import io.eventmatch.core.error.NonBooleanResultException;

/** Enforces that an evaluation result is strictly boolean. Thread-safe: stateless. */
public final class ResultValidator {

    private ResultValidator() {}

    /**
     * Returns the verdict carried by {@code result}.
     *
     * @throws NonBooleanResultException if {@code result} is not a {@link Boolean}
     */
    public static boolean requireBoolean(Object result, String expression) {
        if (result instanceof Boolean) {
            return (Boolean) result;
        }
        throw new NonBooleanResultException(ValueKindClassifier.classify(result), expression);
    }
}
