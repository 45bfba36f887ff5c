package io.eventmatch.core.engine;

import io.eventmatch.core.engine.cel.SafeAccessors;
import io.eventmatch.core.error.EnvironmentBuildException;
import io.eventmatch.core.model.Document;
import io.eventmatch.core.model.ValueKind;
import io.eventmatch.core.model.VariableBinding;
import io.eventmatch.core.model.VariableDeclaration;
import io.eventmatch.core.spi.PathQuery;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the {@link Environment} for one evaluation:
 *
 * <ol>
 * <li>one variable per top-level document key, its kind derived from its value by
 * {@link ValueKindClassifier};</li>
 * <li>the {@link SafeAccessors} functions, closed over the document;</li>
 * <li>caller-supplied declarations (and optional host values), which win on name collision.</li>
 * </ol>
 *
 * <p>
 * Document keys that are not valid expression identifiers (e.g. {@code src-ip}, {@code @timestamp})
 * are not declared; they remain reachable through {@code exists} and {@code safe}.
 *
 * <p>
 * Thread-safe: stateless apart from the shared {@link PathQuery}.
 */
public final class EnvironmentBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(EnvironmentBuilder.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[_a-zA-Z][_a-zA-Z0-9]*");

    /** Reserved words of the expression language; they cannot name variables. */
    private static final Set<String> RESERVED = Set.of(
            "true", "false", "null", "in", "as", "break", "const", "continue", "else", "for", "function", "if",
            "import", "let", "loop", "package", "namespace", "return", "var", "void", "while");

    private final PathQuery pathQuery;

    public EnvironmentBuilder(PathQuery pathQuery) {
        this.pathQuery = Objects.requireNonNull(pathQuery, "pathQuery must not be null");
    }

    /**
     * Builds an environment from the document alone.
     *
     * @param document the parsed event
     * @return a fresh environment
     */
    public Environment build(Document document) {
        return build(document, List.of(), Map.of(), null);
    }

    /**
     * Builds an environment from the document plus caller-supplied declarations and host values.
     *
     * <p>
     * A host value without a declaration is declared with its classified kind. A declaration
     * without a host value takes the document value of the same name, if any, provided its kind
     * matches (or the declaration is dyn); otherwise the variable is declared but unbound.
     *
     * @param document          the parsed event
     * @param extraDeclarations declarations overriding document keys, never {@code null}
     * @param hostValues        values for declared host variables, never {@code null}
     * @param expression        the expression being prepared, for error context (may be {@code null})
     * @return a fresh environment
     * @throws EnvironmentBuildException if the declarations cannot be merged, or a declaration
     *     disagrees with the kind of the host or document value it binds
     */
    public Environment build(
            Document document,
            List<VariableDeclaration> extraDeclarations,
            Map<String, ?> hostValues,
            String expression) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(extraDeclarations, "extraDeclarations must not be null");
        Objects.requireNonNull(hostValues, "hostValues must not be null");

        Map<String, VariableBinding> bindings = new LinkedHashMap<>();
        for (Map.Entry<String, Object> field : document.fields().entrySet()) {
            String name = field.getKey();
            if (!isIdentifier(name)) {
                LOG.debug("Document key is not an identifier, reachable through accessors only: key={}", name);
                continue;
            }
            Object value = field.getValue();
            bindings.put(name, VariableBinding.bound(name, ValueKindClassifier.classify(value), value));
        }

        Map<String, ValueKind> declared = collectDeclarations(extraDeclarations, hostValues, expression);
        for (Map.Entry<String, ValueKind> declaration : declared.entrySet()) {
            String name = declaration.getKey();
            ValueKind kind = declaration.getValue();
            VariableBinding binding;
            if (hostValues.containsKey(name)) {
                binding = VariableBinding.bound(name, kind, hostValues.get(name));
            } else if (document.fields().containsKey(name)) {
                Object value = document.fields().get(name);
                requireDocumentKind(name, kind, value, expression);
                binding = VariableBinding.bound(name, kind, value);
            } else {
                binding = VariableBinding.declaredOnly(name, kind);
            }
            VariableBinding previous = bindings.put(name, binding);
            if (previous != null) {
                LOG.debug(
                        "Declaration overrides document key: name={}, document_kind={}, declared_kind={}",
                        name,
                        previous.kind().displayName(),
                        kind.displayName());
            }
        }

        return new Environment(document, bindings, new SafeAccessors(document, pathQuery));
    }

    /** Validates declarations and host values, returning name → kind in declaration order. */
    private static Map<String, ValueKind> collectDeclarations(
            List<VariableDeclaration> extraDeclarations, Map<String, ?> hostValues, String expression) {
        Map<String, ValueKind> declared = new LinkedHashMap<>();
        for (VariableDeclaration declaration : extraDeclarations) {
            if (declaration == null) {
                throw new EnvironmentBuildException("declaration must not be null", null, expression);
            }
            String name = declaration.name();
            requireIdentifier(name, expression);
            if (declaration.kind() == null) {
                throw new EnvironmentBuildException(
                        "declaration of '" + name + "' has no kind", name, expression);
            }
            ValueKind existing = declared.putIfAbsent(name, declaration.kind());
            if (existing != null && !existing.equals(declaration.kind())) {
                throw new EnvironmentBuildException(
                        "conflicting declarations of '" + name + "': " + existing.displayName() + " and "
                                + declaration.kind().displayName(),
                        name,
                        expression);
            }
        }
        for (Map.Entry<String, ?> host : hostValues.entrySet()) {
            String name = host.getKey();
            requireIdentifier(name, expression);
            ValueKind actual = ValueKindClassifier.classify(host.getValue());
            ValueKind expected = declared.get(name);
            if (expected == null) {
                declared.put(name, actual);
            } else if (!expected.equals(actual) && expected != ValueKind.Scalar.DYN) {
                throw new EnvironmentBuildException(
                        "host value for '" + name + "' is " + actual.displayName() + " but was declared as "
                                + expected.displayName(),
                        name,
                        expression);
            }
        }
        return declared;
    }

    /** A non-dyn declaration may only take over a document value of the same kind. */
    private static void requireDocumentKind(String name, ValueKind declared, Object value, String expression) {
        if (declared == ValueKind.Scalar.DYN) {
            return;
        }
        ValueKind actual = ValueKindClassifier.classify(value);
        if (!declared.equals(actual)) {
            throw new EnvironmentBuildException(
                    "document value for '" + name + "' is " + actual.displayName() + " but was declared as "
                            + declared.displayName(),
                    name,
                    expression);
        }
    }

    private static void requireIdentifier(String name, String expression) {
        if (!isIdentifier(name)) {
            throw new EnvironmentBuildException("invalid variable name: '" + name + "'", name, expression);
        }
    }

    /** Returns {@code true} if {@code name} can be referenced as a variable in an expression. */
    public static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches() && !RESERVED.contains(name);
    }
}
