package io.eventmatch.core.engine.cel;

import com.fasterxml.jackson.databind.JsonNode;
import dev.cel.common.CelFunctionDecl;
import dev.cel.common.CelOverloadDecl;
import dev.cel.common.types.SimpleType;
import dev.cel.runtime.CelRuntime.CelFunctionBinding;
import io.eventmatch.core.model.Document;
import io.eventmatch.core.spi.PathQuery;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Path-based expression functions that tolerate missing and mistyped fields:
 *
 * <ul>
 * <li>{@code exists(path) -> bool}</li>
 * <li>{@code safe(path, string) -> string}, {@code safe(path, double) -> double},
 * {@code safe(path, bool) -> bool}: overload chosen by the type of the default at compile
 * time</li>
 * <li>{@code safeString}, {@code safeNumber}, {@code safeBool}: the same three variants under
 * explicit names</li>
 * </ul>
 *
 * <p>
 * Instances are bound to one {@link Document} and resolve paths against its full tree, so values
 * that are not top-level variables (or whose keys are not valid identifiers) stay reachable. None
 * of the functions ever fails for an absent path, a kind mismatch or a malformed path.
 *
 * <p>
 * Thread-safe: the bound document is immutable.
 */
public final class SafeAccessors {

    public static final String EXISTS = "exists";
    public static final String SAFE = "safe";
    public static final String SAFE_STRING = "safeString";
    public static final String SAFE_NUMBER = "safeNumber";
    public static final String SAFE_BOOL = "safeBool";

    /** Names of all functions contributed to every environment. */
    public static final Set<String> FUNCTION_NAMES = Set.of(EXISTS, SAFE, SAFE_STRING, SAFE_NUMBER, SAFE_BOOL);

    private static final String EXISTS_STRING = "exists_string_bool";
    private static final String SAFE_STRING_STRING = "safe_string_string_string";
    private static final String SAFE_STRING_DOUBLE = "safe_string_double_double";
    private static final String SAFE_STRING_BOOL = "safe_string_bool_bool";
    private static final String NAMED_SAFE_STRING = "safeString_string_string_string";
    private static final String NAMED_SAFE_NUMBER = "safeNumber_string_double_double";
    private static final String NAMED_SAFE_BOOL = "safeBool_string_bool_bool";

    private static final List<CelFunctionDecl> DECLARATIONS = List.of(
            CelFunctionDecl.newFunctionDeclaration(
                    EXISTS, CelOverloadDecl.newGlobalOverload(EXISTS_STRING, SimpleType.BOOL, SimpleType.STRING)),
            CelFunctionDecl.newFunctionDeclaration(
                    SAFE,
                    CelOverloadDecl.newGlobalOverload(
                            SAFE_STRING_STRING, SimpleType.STRING, SimpleType.STRING, SimpleType.STRING),
                    CelOverloadDecl.newGlobalOverload(
                            SAFE_STRING_DOUBLE, SimpleType.DOUBLE, SimpleType.STRING, SimpleType.DOUBLE),
                    CelOverloadDecl.newGlobalOverload(
                            SAFE_STRING_BOOL, SimpleType.BOOL, SimpleType.STRING, SimpleType.BOOL)),
            CelFunctionDecl.newFunctionDeclaration(
                    SAFE_STRING,
                    CelOverloadDecl.newGlobalOverload(
                            NAMED_SAFE_STRING, SimpleType.STRING, SimpleType.STRING, SimpleType.STRING)),
            CelFunctionDecl.newFunctionDeclaration(
                    SAFE_NUMBER,
                    CelOverloadDecl.newGlobalOverload(
                            NAMED_SAFE_NUMBER, SimpleType.DOUBLE, SimpleType.STRING, SimpleType.DOUBLE)),
            CelFunctionDecl.newFunctionDeclaration(
                    SAFE_BOOL,
                    CelOverloadDecl.newGlobalOverload(
                            NAMED_SAFE_BOOL, SimpleType.BOOL, SimpleType.STRING, SimpleType.BOOL)));

    private final Document document;
    private final PathQuery pathQuery;

    public SafeAccessors(Document document, PathQuery pathQuery) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.pathQuery = Objects.requireNonNull(pathQuery, "pathQuery must not be null");
    }

    /** Checker declarations for all accessor functions. Identical for every document. */
    public static List<CelFunctionDecl> declarations() {
        return DECLARATIONS;
    }

    /** Runtime bindings for all accessor functions, closed over this instance's document. */
    public List<CelFunctionBinding> bindings() {
        return List.of(
                CelFunctionBinding.from(EXISTS_STRING, String.class, this::exists),
                CelFunctionBinding.from(SAFE_STRING_STRING, String.class, String.class, this::safeString),
                CelFunctionBinding.from(SAFE_STRING_DOUBLE, String.class, Double.class, this::safeNumber),
                CelFunctionBinding.from(SAFE_STRING_BOOL, String.class, Boolean.class, this::safeBool),
                CelFunctionBinding.from(NAMED_SAFE_STRING, String.class, String.class, this::safeString),
                CelFunctionBinding.from(NAMED_SAFE_NUMBER, String.class, Double.class, this::safeNumber),
                CelFunctionBinding.from(NAMED_SAFE_BOOL, String.class, Boolean.class, this::safeBool));
    }

    /** Returns {@code true} iff a value (including JSON {@code null}) is reachable at {@code path}. */
    public boolean exists(String path) {
        return find(path).isPresent();
    }

    /** Returns the string at {@code path}, or {@code defaultValue} if absent or not a string. */
    public String safeString(String path, String defaultValue) {
        return find(path).filter(JsonNode::isTextual).map(JsonNode::textValue).orElse(defaultValue);
    }

    /** Returns the number at {@code path} as a double, or {@code defaultValue} if absent or not a number. */
    public Double safeNumber(String path, Double defaultValue) {
        return find(path).filter(JsonNode::isNumber).map(JsonNode::doubleValue).orElse(defaultValue);
    }

    /** Returns the boolean at {@code path}, or {@code defaultValue} if absent or not a boolean. */
    public Boolean safeBool(String path, Boolean defaultValue) {
        return find(path).filter(JsonNode::isBoolean).map(JsonNode::booleanValue).orElse(defaultValue);
    }

    private Optional<JsonNode> find(String path) {
        return pathQuery.lookup(document.tree(), path);
    }
}
