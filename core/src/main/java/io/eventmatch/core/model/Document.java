package io.eventmatch.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.eventmatch.core.error.NilInputException;
import io.eventmatch.core.error.PayloadParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An event payload held both as its raw JSON text and as a parsed tree. The top-level object is
 * additionally exposed as a read-only, insertion-ordered map of plain Java values:
 *
 * <ul>
 * <li>JSON strings → {@link String}</li>
 * <li>JSON booleans → {@link Boolean}</li>
 * <li>every JSON number → {@link Double}, integral or not, so a field keeps one kind across
 * events</li>
 * <li>objects → {@code Map<String, Object>}, arrays → {@code List<Object>}</li>
 * <li>JSON {@code null} → {@code null}</li>
 * </ul>
 *
 * <p>
 * A JSON {@code null} root is read as an empty object. Arrays, scalars, empty input and trailing
 * content are rejected. A duplicated key keeps its last value.
 *
 * <p>
 * Immutable once parsed.
 */
public final class Document {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private final String raw;
    private final JsonNode tree;
    private final Map<String, Object> fields;

    private Document(String raw, JsonNode tree, Map<String, Object> fields) {
        this.raw = raw;
        this.tree = tree;
        this.fields = fields;
    }

    /**
     * Parses a JSON document whose root must be an object or {@code null}.
     *
     * @param raw the JSON text
     * @return the parsed document
     * @throws NilInputException     if {@code raw} is {@code null}
     * @throws PayloadParseException if {@code raw} is not a well-formed JSON object
     */
    public static Document parse(String raw) {
        if (raw == null) {
            throw new NilInputException("data is nil");
        }
        JsonNode tree;
        try {
            tree = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("cannot unmarshal data: " + e.getOriginalMessage(), e);
        }
        if (tree != null && tree.isNull()) {
            tree = MAPPER.createObjectNode();
        }
        if (tree == null || !tree.isObject()) {
            String found = tree == null || tree.isMissingNode() ? "empty input" : tree.getNodeType().toString();
            throw new PayloadParseException("cannot unmarshal data: expected a JSON object, got " + found);
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> fields = (Map<String, Object>) toJava(tree);
        return new Document(raw, tree, fields);
    }

    /** The original JSON text. */
    public String raw() {
        return raw;
    }

    /** The parsed tree of {@link #raw()}; callers must not mutate it. */
    public JsonNode tree() {
        return tree;
    }

    /** Top-level fields as plain Java values, in document order. */
    public Map<String, Object> fields() {
        return fields;
    }

    private static Object toJava(JsonNode node) {
        switch (node.getNodeType()) {
            case OBJECT: {
                Map<String, Object> map = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> it = node.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> entry = it.next();
                    map.put(entry.getKey(), toJava(entry.getValue()));
                }
                return Collections.unmodifiableMap(map);
            }
            case ARRAY: {
                List<Object> list = new ArrayList<>(node.size());
                for (JsonNode element : node) {
                    list.add(toJava(element));
                }
                return Collections.unmodifiableList(list);
            }
            case STRING:
                return node.textValue();
            case BOOLEAN:
                return node.booleanValue();
            case NUMBER:
                return node.doubleValue();
            case BINARY:
                try {
                    return node.binaryValue();
                } catch (java.io.IOException e) {
                    throw new PayloadParseException("cannot read binary value: " + e.getMessage(), e);
                }
            default:
                // NULL, MISSING, POJO
                return null;
        }
    }
}
