package io.eventmatch.core.engine.path;

import com.fasterxml.jackson.databind.JsonNode;
import io.eventmatch.core.spi.PathQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Default {@link PathQuery} over Jackson trees.
 *
 * <p>
 * Path grammar:
 * <ul>
 * <li>{@code field}, {@code field.sub}: object member access, segments separated by {@code .}</li>
 * <li>{@code field[0]}, {@code field[0][1].sub}: array indexing with brackets</li>
 * <li>{@code field.0.sub}: a numeric dotted segment indexes into an array (and is a plain member
 * name on an object)</li>
 * <li>{@code \.}: a literal dot inside a member name</li>
 * </ul>
 *
 * <p>
 * Empty segments, unterminated or non-numeric brackets and a trailing backslash make the path
 * malformed; malformed paths resolve to empty. Thread-safe: stateless.
 */
public final class JsonNodePathQuery implements PathQuery {

    /** Shared stateless instance. */
    public static final JsonNodePathQuery INSTANCE = new JsonNodePathQuery();

    @Override
    public Optional<JsonNode> lookup(JsonNode root, String path) {
        if (root == null || path == null || path.isEmpty()) {
            return Optional.empty();
        }
        List<Segment> segments = parse(path);
        if (segments == null) {
            return Optional.empty();
        }
        JsonNode current = root;
        for (Segment segment : segments) {
            current = segment.select(current);
            if (current == null || current.isMissingNode()) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    /** Parses a path into segments, or returns {@code null} if it is malformed. */
    static List<Segment> parse(String path) {
        List<Segment> segments = new ArrayList<>();
        StringBuilder name = new StringBuilder();
        boolean nameStarted = false;
        int i = 0;
        int n = path.length();
        while (i < n) {
            char c = path.charAt(i);
            if (c == '\\') {
                if (i + 1 >= n) {
                    return null;
                }
                name.append(path.charAt(i + 1));
                nameStarted = true;
                i += 2;
            } else if (c == '.') {
                if (!nameStarted) {
                    // ".a", "a..b" and "a[0]." style input; a dot right after ']' is fine
                    if (segments.isEmpty() || !(segments.get(segments.size() - 1) instanceof Index)
                            || i + 1 >= n) {
                        return null;
                    }
                } else {
                    if (i + 1 >= n) {
                        return null;
                    }
                    segments.add(new Name(name.toString()));
                    name.setLength(0);
                    nameStarted = false;
                }
                i++;
            } else if (c == '[') {
                if (nameStarted) {
                    segments.add(new Name(name.toString()));
                    name.setLength(0);
                    nameStarted = false;
                } else if (segments.isEmpty() || path.charAt(i - 1) != ']') {
                    return null;
                }
                int close = path.indexOf(']', i);
                if (close < 0 || close == i + 1) {
                    return null;
                }
                String digits = path.substring(i + 1, close);
                if (!isDigits(digits) || digits.length() > 9) {
                    return null;
                }
                segments.add(new Index(Integer.parseInt(digits)));
                i = close + 1;
                if (i < n && path.charAt(i) != '.' && path.charAt(i) != '[') {
                    return null;
                }
            } else {
                name.append(c);
                nameStarted = true;
                i++;
            }
        }
        if (nameStarted) {
            segments.add(new Name(name.toString()));
        }
        return segments.isEmpty() ? null : segments;
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /** One step of a path. */
    sealed interface Segment permits Name, Index {
        /** Returns the selected child, or {@code null} if absent. */
        JsonNode select(JsonNode node);
    }

    /** Object member access; numeric names also index arrays. */
    record Name(String name) implements Segment {
        @Override
        public JsonNode select(JsonNode node) {
            if (node.isObject()) {
                return node.get(name);
            }
            if (node.isArray() && isDigits(name) && name.length() <= 9) {
                return node.get(Integer.parseInt(name));
            }
            return null;
        }
    }

    /** Bracketed array index. */
    record Index(int index) implements Segment {
        @Override
        public JsonNode select(JsonNode node) {
            return node.isArray() ? node.get(index) : null;
        }
    }
}
