package io.eventmatch.core.engine.cel;

import dev.cel.common.CelAbstractSyntaxTree;
import dev.cel.common.CelOptions;
import dev.cel.runtime.CelEvaluationException;
import dev.cel.runtime.CelRuntime;
import dev.cel.runtime.CelRuntimeFactory;
import io.eventmatch.core.error.ExpressionEvalException;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a checked syntax tree into an executable program whose accessor functions are bound to one
 * document, and runs it.
 *
 * <p>
 * Thread-safe: holds only immutable options; each planned program belongs to a single call.
 */
public final class CelProgramPlanner {

    private final CelOptions celOptions;

    public CelProgramPlanner(CelOptions celOptions) {
        this.celOptions = Objects.requireNonNull(celOptions, "celOptions must not be null");
    }

    /**
     * Plans an executable program for {@code ast}.
     *
     * @param ast        a syntax tree checked against the environment {@code accessors} belongs to
     * @param accessors  accessor functions bound to the event document
     * @param expression the expression text, for error context
     * @throws ExpressionEvalException if the runtime rejects the tree
     */
    public Executable plan(CelAbstractSyntaxTree ast, SafeAccessors accessors, String expression) {
        CelRuntime runtime = CelRuntimeFactory.standardCelRuntimeBuilder()
                .setOptions(celOptions)
                .addFunctionBindings(accessors.bindings())
                .build();
        try {
            return new Executable(runtime.createProgram(ast), expression);
        } catch (CelEvaluationException e) {
            throw new ExpressionEvalException("failed to create program: " + e.getMessage(), e, expression);
        }
    }

    /** A program ready to run against the variable values of its environment. */
    public static final class Executable {

        private final CelRuntime.Program program;
        private final String expression;

        Executable(CelRuntime.Program program, String expression) {
            this.program = program;
            this.expression = expression;
        }

        /**
         * Runs the program.
         *
         * @param activation CEL-converted variable values
         * @return the raw result value
         * @throws ExpressionEvalException on any runtime failure
         */
        public Object run(Map<String, ?> activation) {
            try {
                return program.eval(activation);
            } catch (CelEvaluationException e) {
                throw new ExpressionEvalException("failed to evaluate program: " + e.getMessage(), e, expression);
            } catch (RuntimeException e) {
                // accessor bindings and value adapters surface as unchecked exceptions
                throw new ExpressionEvalException("failed to evaluate program: " + e, e, expression);
            }
        }
    }
}
