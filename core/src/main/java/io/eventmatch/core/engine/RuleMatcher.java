package io.eventmatch.core.engine;

import io.eventmatch.core.error.RuleEvaluationException;
import io.eventmatch.core.model.DetectionRule;
import io.eventmatch.core.model.Document;
import io.eventmatch.core.model.MatchReport;
import io.eventmatch.core.model.VariableDeclaration;
import io.eventmatch.core.spi.RuleConfigProvider;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Matches one event against a set of detection rules.
 *
 * <p>
 * The event is parsed once; every enabled rule is then evaluated with its own environment and
 * program. A rule that fails to evaluate is recorded in {@link MatchReport#failures()} and treated
 * as not applicable to this event. Input and parse errors apply to every rule and abort the call.
 *
 * <p>
 * The disabled-rule set is read from the {@link RuleConfigProvider} once per call, before any rule
 * runs. Thread-safe.
 */
public final class RuleMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(RuleMatcher.class);

    /** MDC key holding the id of the rule being evaluated. */
    public static final String MDC_RULE_ID = "rule_id";

    private final RuleEvaluator evaluator;
    private final RuleConfigProvider configProvider;

    public RuleMatcher(RuleEvaluator evaluator) {
        this(evaluator, RuleConfigProvider.none());
    }

    public RuleMatcher(RuleEvaluator evaluator, RuleConfigProvider configProvider) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.configProvider = Objects.requireNonNull(configProvider, "configProvider must not be null");
    }

    /**
     * Matches {@code data} against {@code rules}.
     *
     * @throws io.eventmatch.core.error.NilInputException     if {@code data} is {@code null}
     * @throws io.eventmatch.core.error.PayloadParseException if {@code data} is not a JSON object
     */
    public MatchReport match(String data, List<DetectionRule> rules) {
        return match(data, rules, List.of(), Map.of());
    }

    /**
     * Matches {@code data} against {@code rules}, with host declarations and values available to
     * every rule.
     *
     * @throws io.eventmatch.core.error.NilInputException     if {@code data} is {@code null}
     * @throws io.eventmatch.core.error.PayloadParseException if {@code data} is not a JSON object
     */
    public MatchReport match(
            String data,
            List<DetectionRule> rules,
            List<VariableDeclaration> extraDeclarations,
            Map<String, ?> hostValues) {
        Document document = Document.parse(data);
        Set<Long> disabledRules = configProvider.disabledRules();

        List<Long> matched = new ArrayList<>();
        List<Long> disabled = new ArrayList<>();
        Map<Long, RuleEvaluationException> failures = new LinkedHashMap<>();
        for (DetectionRule rule : rules) {
            if (disabledRules.contains(rule.id())) {
                disabled.add(rule.id());
                continue;
            }
            MDC.put(MDC_RULE_ID, Long.toString(rule.id()));
            try {
                if (evaluator.evaluate(rule.expression(), document, extraDeclarations, hostValues)) {
                    matched.add(rule.id());
                }
            } catch (RuleEvaluationException e) {
                LOG.debug("Rule not applicable to event: rule_id={}, rule={}, stage={}, detail={}",
                        rule.id(), rule.name(), e.stage(), e.detail());
                failures.put(rule.id(), e);
            } finally {
                MDC.remove(MDC_RULE_ID);
            }
        }
        LOG.debug("Event matched: rules={}, matched={}, disabled={}, failed={}",
                rules.size(), matched.size(), disabled.size(), failures.size());
        return new MatchReport(matched, disabled, failures);
    }
}
