package io.eventmatch.core.spi;

import java.util.Set;

/**
 * Supplies the rule configuration the matcher consults before evaluating an event. Hosts back it
 * with whatever configuration source they refresh; the evaluator itself never reads configuration.
 *
 * <p>
 * Implementations MUST be thread-safe.
 */
public interface RuleConfigProvider {

    /** Ids of rules that must not be evaluated. Never {@code null}. */
    Set<Long> disabledRules();

    /** A provider with no disabled rules. */
    static RuleConfigProvider none() {
        return () -> Set.of();
    }
}
