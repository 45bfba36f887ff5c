package io.eventmatch.core.engine.cel;

import dev.cel.common.CelAbstractSyntaxTree;
import dev.cel.common.CelIssue;
import dev.cel.common.CelOptions;
import dev.cel.common.CelSourceLocation;
import dev.cel.common.CelValidationException;
import dev.cel.common.CelValidationResult;
import dev.cel.compiler.CelCompiler;
import dev.cel.compiler.CelCompilerBuilder;
import dev.cel.compiler.CelCompilerFactory;
import dev.cel.parser.CelStandardMacro;
import io.eventmatch.core.engine.Environment;
import io.eventmatch.core.error.CompileIssue;
import io.eventmatch.core.error.ExpressionCompileException;
import io.eventmatch.core.model.VariableBinding;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses and type-checks CEL expressions against an {@link Environment}. Every identifier must
 * resolve to a declared variable or function, and every call must match a declared overload;
 * otherwise compilation fails with all issues reported at once.
 *
 * <p>
 * A checker is built per environment, since each event may declare a different variable set.
 * Thread-safe: holds only immutable options.
 */
public final class CelExpressionCompiler {

    private final CelOptions celOptions;
    private final int maxExpressionLength;

    public CelExpressionCompiler(CelOptions celOptions, int maxExpressionLength) {
        this.celOptions = Objects.requireNonNull(celOptions, "celOptions must not be null");
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        this.maxExpressionLength = maxExpressionLength;
    }

    /**
     * Compiles {@code expression} against {@code environment}.
     *
     * @return the checked syntax tree, valid only for environments with the same signature
     * @throws ExpressionCompileException if the expression is blank, too long, or fails to parse or
     *     type-check
     */
    public CelAbstractSyntaxTree compile(String expression, Environment environment) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionCompileException(expression, List.of(CompileIssue.of("expression is empty")));
        }
        if (expression.length() > maxExpressionLength) {
            throw new ExpressionCompileException(
                    expression,
                    List.of(CompileIssue.of("expression exceeds " + maxExpressionLength + " characters")));
        }

        CelValidationResult result = checkerFor(environment).compile(expression);
        if (result.hasError()) {
            throw new ExpressionCompileException(expression, toIssues(result.getErrors()));
        }
        try {
            return result.getAst();
        } catch (CelValidationException e) {
            throw new ExpressionCompileException(expression, toIssues(e.getErrors()), e);
        }
    }

    private CelCompiler checkerFor(Environment environment) {
        CelCompilerBuilder builder = CelCompilerFactory.standardCelCompilerBuilder()
                .setOptions(celOptions)
                .setStandardMacros(CelStandardMacro.STANDARD_MACROS)
                .addFunctionDeclarations(SafeAccessors.declarations());
        for (VariableBinding binding : environment.bindings()) {
            builder.addVar(binding.name(), CelTypes.of(binding.kind()));
        }
        return builder.build();
    }

    private static List<CompileIssue> toIssues(List<CelIssue> celIssues) {
        List<CompileIssue> issues = new ArrayList<>(celIssues.size());
        for (CelIssue issue : celIssues) {
            CelSourceLocation location = issue.getSourceLocation();
            issues.add(new CompileIssue(issue.getMessage(), location.getLine(), location.getColumn()));
        }
        if (issues.isEmpty()) {
            issues.add(CompileIssue.of("expression failed validation"));
        }
        return issues;
    }
}
