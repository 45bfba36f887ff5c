package io.eventmatch.core.engine;

import io.eventmatch.core.engine.cel.CelProgramPlanner.Executable;

/**
 * One expression compiled against one {@link Environment}. A program only ever runs with the
 * variable values of the environment it was compiled against, and is discarded after use.
 */
public final class Program {

    private final String expression;
    private final Environment environment;
    private final Executable executable;

    Program(String expression, Environment environment, Executable executable) {
        this.expression = expression;
        this.environment = environment;
        this.executable = executable;
    }

    public String expression() {
        return expression;
    }

    public Environment environment() {
        return environment;
    }

    /**
     * Runs the program against its environment's bound values.
     *
     * @return the raw, dynamically typed result
     * @throws io.eventmatch.core.error.ExpressionEvalException on any runtime failure
     */
    public Object evaluate() {
        return executable.run(environment.activation());
    }
}
