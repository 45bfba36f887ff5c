package io.eventmatch.core.engine;

import dev.cel.common.CelAbstractSyntaxTree;
import dev.cel.common.CelOptions;
import io.eventmatch.core.config.EvaluatorOptions;
import io.eventmatch.core.engine.cel.CelExpressionCompiler;
import io.eventmatch.core.engine.cel.CelProgramPlanner;
import io.eventmatch.core.engine.path.JsonNodePathQuery;
import io.eventmatch.core.error.RuleEvaluationException;
import io.eventmatch.core.model.Document;
import io.eventmatch.core.model.VariableDeclaration;
import io.eventmatch.core.spi.EvaluationListener;
import io.eventmatch.core.spi.EvaluationListener.EvaluationCompletedEvent;
import io.eventmatch.core.spi.EvaluationListener.EvaluationFailedEvent;
import io.eventmatch.core.spi.PathQuery;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a rule expression matches an event.
 *
 * <p>
 * Pipeline: parse the event → build the environment → compile → evaluate → require a boolean.
 * Each stage is strict; the first failure aborts the call with that stage's
 * {@link RuleEvaluationException} subclass. Missing or mistyped fields are not failures when the
 * expression reaches them through {@code exists} / {@code safe}.
 *
 * <p>
 * Thread-safe: every call builds its own document, environment and program. When the program cache
 * is enabled, only checked syntax trees are shared, keyed by expression and environment signature.
 */
public final class RuleEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(RuleEvaluator.class);

    private final EvaluatorOptions options;
    private final EnvironmentBuilder environmentBuilder;
    private final CelExpressionCompiler compiler;
    private final CelProgramPlanner planner;
    private final ProgramCache programCache;
    private final EvaluationListener listener;

    /** Creates an evaluator with {@link EvaluatorOptions#DEFAULT}. */
    public RuleEvaluator() {
        this(EvaluatorOptions.DEFAULT);
    }

    public RuleEvaluator(EvaluatorOptions options) {
        this(options, JsonNodePathQuery.INSTANCE, null);
    }

    /**
     * Creates an evaluator.
     *
     * @param options   evaluation options
     * @param pathQuery path resolver backing {@code exists} / {@code safe}
     * @param listener  lifecycle listener, or {@code null} for none
     */
    public RuleEvaluator(EvaluatorOptions options, PathQuery pathQuery, EvaluationListener listener) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.environmentBuilder = new EnvironmentBuilder(pathQuery);
        CelOptions celOptions = CelOptions.current()
                .enableHeterogeneousNumericComparisons(options.heterogeneousNumericComparisons())
                .enableUnsignedLongs(true)
                .build();
        this.compiler = new CelExpressionCompiler(celOptions, options.maxExpressionLength());
        this.planner = new CelProgramPlanner(celOptions);
        this.programCache = options.programCacheEnabled() ? new ProgramCache(options.programCacheSize()) : null;
        this.listener = listener;
    }

    public EvaluatorOptions options() {
        return options;
    }

    /**
     * Evaluates {@code expression} against the JSON event {@code data}.
     *
     * @return the verdict
     * @throws RuleEvaluationException if any stage fails
     */
    public boolean evaluate(String expression, String data) {
        return evaluate(expression, data, List.of(), Map.of());
    }

    /**
     * Evaluates {@code expression} against {@code data} with additional declarations.
     *
     * @throws RuleEvaluationException if any stage fails
     */
    public boolean evaluate(String expression, String data, List<VariableDeclaration> extraDeclarations) {
        return evaluate(expression, data, extraDeclarations, Map.of());
    }

    /**
     * Evaluates {@code expression} against {@code data} with additional declarations and host
     * values.
     *
     * @param expression        the rule body
     * @param data              the JSON event; {@code null} is rejected before anything else
     * @param extraDeclarations declarations overriding document keys
     * @param hostValues        values for host-declared variables
     * @return the verdict
     * @throws RuleEvaluationException if any stage fails
     */
    public boolean evaluate(
            String expression,
            String data,
            List<VariableDeclaration> extraDeclarations,
            Map<String, ?> hostValues) {
        long start = System.nanoTime();
        Document document;
        try {
            document = Document.parse(data);
        } catch (RuleEvaluationException e) {
            failed(expression, e, start);
            throw e;
        }
        return evaluate(expression, document, extraDeclarations, hostValues, start);
    }

    /**
     * Evaluates {@code expression} against an already parsed document. The environment and
     * program are still built from scratch for this call.
     *
     * @throws RuleEvaluationException if any stage after parsing fails
     */
    public boolean evaluate(
            String expression,
            Document document,
            List<VariableDeclaration> extraDeclarations,
            Map<String, ?> hostValues) {
        return evaluate(expression, document, extraDeclarations, hostValues, System.nanoTime());
    }

    /**
     * Compiles {@code expression} against a fresh environment for {@code document}, without
     * running it.
     *
     * @throws RuleEvaluationException if the environment cannot be built or compilation fails
     */
    public Program compile(
            String expression,
            Document document,
            List<VariableDeclaration> extraDeclarations,
            Map<String, ?> hostValues) {
        Environment environment = environmentBuilder.build(document, extraDeclarations, hostValues, expression);
        CelAbstractSyntaxTree ast = programCache == null
                ? compiler.compile(expression, environment)
                : programCache.getOrCompile(
                        expression, environment.signature(), () -> compiler.compile(expression, environment));
        return new Program(expression, environment, planner.plan(ast, environment.accessors(), expression));
    }

    private boolean evaluate(
            String expression,
            Document document,
            List<VariableDeclaration> extraDeclarations,
            Map<String, ?> hostValues,
            long start) {
        try {
            Program program = compile(expression, document, extraDeclarations, hostValues);
            boolean matched = ResultValidator.requireBoolean(program.evaluate(), expression);
            completed(expression, matched, start);
            return matched;
        } catch (RuleEvaluationException e) {
            failed(expression, e, start);
            throw e;
        }
    }

    private void completed(String expression, boolean matched, long start) {
        if (listener == null) {
            return;
        }
        try {
            listener.onEvaluationCompleted(new EvaluationCompletedEvent(expression, matched, System.nanoTime() - start));
        } catch (Exception e) {
            LOG.warn("EvaluationListener.onEvaluationCompleted failed", e);
        }
    }

    private void failed(String expression, RuleEvaluationException error, long start) {
        LOG.debug("Rule evaluation failed: stage={}, context={}", error.stage(), error.context());
        if (listener == null) {
            return;
        }
        try {
            listener.onEvaluationFailed(
                    new EvaluationFailedEvent(expression, error.stage(), error.detail(), System.nanoTime() - start));
        } catch (Exception e) {
            LOG.warn("EvaluationListener.onEvaluationFailed failed", e);
        }
    }
}
