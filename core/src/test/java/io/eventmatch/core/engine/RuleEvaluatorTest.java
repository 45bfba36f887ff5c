package io.eventmatch.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.eventmatch.core.config.EvaluatorOptions;
import io.eventmatch.core.error.EnvironmentBuildException;
import io.eventmatch.core.error.ExpressionCompileException;
import io.eventmatch.core.error.ExpressionEvalException;
import io.eventmatch.core.error.NilInputException;
import io.eventmatch.core.error.NonBooleanResultException;
import io.eventmatch.core.error.PayloadParseException;
import io.eventmatch.core.error.RuleEvaluationException;
import io.eventmatch.core.model.Document;
import io.eventmatch.core.model.ValueKind.Scalar;
import io.eventmatch.core.model.VariableDeclaration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** End-to-end tests for {@link RuleEvaluator}: parse → environment → compile → evaluate → validate. */
@DisplayName("RuleEvaluatorTest")
class RuleEvaluatorTest {

    private final RuleEvaluator evaluator = new RuleEvaluator();

    @Nested
    @DisplayName("verdicts")
    class Verdicts {

        @Test
        void topLevelVariablesAndSafeDefault() {
            assertThat(evaluator.evaluate(
                            "age > 18 && safe(\"role\", \"guest\") == \"guest\"", "{\"user\":\"alice\",\"age\":30}"))
                    .isTrue();
        }

        @Test
        void existsOnNestedPaths() {
            assertThat(evaluator.evaluate("exists(\"a.b\") && !exists(\"a.c\")", "{\"a\":{\"b\":1}}"))
                    .isTrue();
        }

        @Test
        void safeFallsBackOnKindMismatch() {
            assertThat(evaluator.evaluate("safe(\"score\", 0.0) == 0.0", "{\"score\":\"notanumber\"}"))
                    .isTrue();
        }

        @ParameterizedTest(name = "{0} → {1}")
        @CsvSource(delimiterString = "=>", quoteCharacter = '"', value = {
            "user == 'alice' && age >= 30                => true",
            "user == 'bob' || age < 18                   => false",
            "'admin' in roles                            => true",
            "roles.exists(r, r == 'dev')                 => true",
            "size(roles) == 2                            => true",
            "net.port == 22.0 && net.proto == 'tcp'      => true",
            "safe('net.port', 0.0) > 20.0                => true",
            "safeNumber('net.port', 0.0) == 22.0         => true",
            "safeString('net.proto', '') == 'tcp'        => true",
            "safeBool('flags.enabled', false)            => true",
            "safe('flags.missing', true)                 => true",
            "safe('src-ip', '') == '10.0.0.1'            => true",
            "exists('roles[1]') && !exists('roles[2]')   => true",
            "exists('missing.path')                      => false",
            "note == null                                => true",
            "ratio > 0.25                                => true",
            "ratio > 0                                   => true"
        })
        void evaluatesAgainstEvent(String expression, boolean expected) {
            String event = """
                    {"user": "alice", "age": 30, "ratio": 0.5, "roles": ["admin", "dev"],
                     "net": {"port": 22, "proto": "tcp"}, "flags": {"enabled": true},
                     "src-ip": "10.0.0.1", "note": null}
                    """;

            assertThat(evaluator.evaluate(expression, event)).isEqualTo(expected);
        }

        @Test
        void largeIntegersCompareAsDoubles() {
            assertThat(evaluator.evaluate("big > 1.8e19", "{\"big\":18446744073709551615}")).isTrue();
        }

        @Test
        void integralNumbersAreDoubles() {
            assertThat(evaluator.evaluate("n == safe('n', 0.0)", "{\"n\":5}")).isTrue();
            assertThat(evaluator.evaluate("n == 5.0", "{\"n\":5}")).isTrue();
        }

        @Test
        void numericFieldKeepsItsKindAcrossEvents() {
            assertThat(evaluator.evaluate("n == 5.0", "{\"n\":5}")).isTrue();
            assertThat(evaluator.evaluate("n == 5.0", "{\"n\":5.5}")).isFalse();
            assertThat(evaluator.evaluate("n == 5.0", "{\"n\":5e0}")).isTrue();
        }

        @Test
        void nullPayloadHasNoVariables() {
            assertThat(evaluator.evaluate("!exists('a')", "null")).isTrue();
            assertThat(evaluator.evaluate("safe('a', 'none') == 'none'", "null")).isTrue();
        }

        @Test
        void duplicateKeyUsesLastValue() {
            assertThat(evaluator.evaluate("a == 'second' && safe('a', '') == 'second'",
                    "{\"a\":\"first\",\"a\":\"second\"}")).isTrue();
        }

        @Test
        void hostValuesAreVisible() {
            boolean matched = evaluator.evaluate(
                    "age > threshold && tenant == 'acme'",
                    "{\"age\":30}",
                    List.of(VariableDeclaration.of("threshold", Scalar.INT)),
                    Map.of("threshold", 18L, "tenant", "acme"));

            assertThat(matched).isTrue();
        }

        @Test
        void declarationRetypesDocumentValue() {
            boolean matched = evaluator.evaluate(
                    "count == 3.0", "{\"count\":3}", List.of(VariableDeclaration.of("count", Scalar.DYN)));

            assertThat(matched).isTrue();
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        void nilDataIsRejectedRegardlessOfExpression() {
            assertThatThrownBy(() -> evaluator.evaluate("true", null)).isInstanceOf(NilInputException.class);
            assertThatThrownBy(() -> evaluator.evaluate("not even (valid", null))
                    .isInstanceOf(NilInputException.class);
        }

        @Test
        void malformedDataIsRejected() {
            assertThatThrownBy(() -> evaluator.evaluate("true", "{oops")).isInstanceOf(PayloadParseException.class);
        }

        @Test
        void undeclaredIdentifierIsCompileError() {
            assertThatThrownBy(() -> evaluator.evaluate("missing == 1", "{\"present\":1}"))
                    .isInstanceOf(ExpressionCompileException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        void compileErrorListsAllIssues() {
            ExpressionCompileException error = (ExpressionCompileException) catchRuleError(
                    () -> evaluator.evaluate("foo > 1 && bar < 2", "{}"));

            assertThat(error.issues()).hasSizeGreaterThanOrEqualTo(2);
            assertThat(error.getMessage()).contains("foo").contains("bar");
            assertThat(error.expression()).isEqualTo("foo > 1 && bar < 2");
        }

        @Test
        void syntaxErrorIsCompileError() {
            assertThatThrownBy(() -> evaluator.evaluate("age > ", "{\"age\":1}"))
                    .isInstanceOf(ExpressionCompileException.class);
        }

        @Test
        void safeOverloadIsChosenByDefaultLiteralType() {
            // 0 is an int literal; only string, double and bool defaults are declared
            assertThatThrownBy(() -> evaluator.evaluate("safe('score', 0) == 0", "{\"score\":1}"))
                    .isInstanceOf(ExpressionCompileException.class);
        }

        @Test
        void mismatchedOperandKindsAreCompileError() {
            assertThatThrownBy(() -> evaluator.evaluate("user > 1", "{\"user\":\"alice\"}"))
                    .isInstanceOf(ExpressionCompileException.class);
        }

        @Test
        void blankExpressionIsCompileError() {
            assertThatThrownBy(() -> evaluator.evaluate("  ", "{}")).isInstanceOf(ExpressionCompileException.class);
        }

        @Test
        void overlongExpressionIsCompileError() {
            RuleEvaluator strict = new RuleEvaluator(EvaluatorOptions.DEFAULT.withMaxExpressionLength(10));

            assertThatThrownBy(() -> strict.evaluate("true && true && true", "{}"))
                    .isInstanceOf(ExpressionCompileException.class)
                    .hasMessageContaining("exceeds 10 characters");
        }

        @Test
        void arithmeticResultIsNonBoolean() {
            assertThatThrownBy(() -> evaluator.evaluate("age + 1.0", "{\"age\":30}"))
                    .isInstanceOf(NonBooleanResultException.class)
                    .satisfies(e -> assertThat(((NonBooleanResultException) e).resultKind()).isEqualTo(Scalar.DOUBLE));
        }

        @Test
        void stringResultIsNonBoolean() {
            assertThatThrownBy(() -> evaluator.evaluate("safe('user', '')", "{\"user\":\"alice\"}"))
                    .isInstanceOf(NonBooleanResultException.class)
                    .hasMessageContaining("string");
        }

        @Test
        void divisionByZeroIsEvaluationError() {
            assertThatThrownBy(() -> evaluator.evaluate("int(age) / 0 == 1", "{\"age\":30}"))
                    .isInstanceOf(ExpressionEvalException.class);
        }

        @Test
        void missingMapKeyIsEvaluationError() {
            assertThatThrownBy(() -> evaluator.evaluate("a.c == 1", "{\"a\":{\"b\":1}}"))
                    .isInstanceOf(ExpressionEvalException.class);
        }

        @Test
        void declarationConflictingWithDocumentValueIsEnvironmentError() {
            assertThatThrownBy(() -> evaluator.evaluate(
                            "age.startsWith('3')", "{\"age\":30}", List.of(VariableDeclaration.of("age", Scalar.STRING))))
                    .isInstanceOf(EnvironmentBuildException.class);
        }

        @Test
        void declaredButUnboundVariableFails() {
            assertThatThrownBy(() -> evaluator.evaluate(
                            "tenant == 'acme'", "{}", List.of(VariableDeclaration.of("tenant", Scalar.STRING))))
                    .isInstanceOf(RuleEvaluationException.class);
        }

        @Test
        void heterogeneousComparisonCanBeDisabled() {
            RuleEvaluator homogeneous =
                    new RuleEvaluator(EvaluatorOptions.DEFAULT.withHeterogeneousNumericComparisons(false));

            assertThatThrownBy(() -> homogeneous.evaluate("ratio > 0", "{\"ratio\":0.5}"))
                    .isInstanceOf(ExpressionCompileException.class);
            assertThat(homogeneous.evaluate("ratio > 0.0", "{\"ratio\":0.5}")).isTrue();
        }
    }

    @Test
    void compiledProgramRunsAgainstItsOwnEnvironment() {
        Document document = Document.parse("{\"age\":30}");
        Program program = evaluator.compile("age > 18", document, List.of(), Map.of());

        assertThat(program.environment().document()).isSameAs(document);
        assertThat(program.evaluate()).isEqualTo(true);
    }

    private static RuleEvaluationException catchRuleError(Runnable call) {
        try {
            call.run();
        } catch (RuleEvaluationException e) {
            return e;
        }
        throw new AssertionError("expected a RuleEvaluationException");
    }
}
