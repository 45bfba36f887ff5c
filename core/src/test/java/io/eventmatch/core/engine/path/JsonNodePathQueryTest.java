package io.eventmatch.core.engine.path;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link JsonNodePathQuery}. */
class JsonNodePathQueryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static JsonNode root;

    private final JsonNodePathQuery query = JsonNodePathQuery.INSTANCE;

    @BeforeAll
    static void parse() throws Exception {
        root = MAPPER.readTree("""
                {
                  "user": {"name": "alice", "roles": ["admin", "dev"]},
                  "events": [{"id": 1, "tags": [["x", "y"]]}, {"id": 2}],
                  "a.b": "dotted",
                  "7": "numeric key",
                  "gone": null
                }
                """);
    }

    @Test
    void resolvesNestedMembers() {
        assertThat(query.lookup(root, "user.name")).hasValueSatisfying(n -> assertThat(n.textValue())
                .isEqualTo("alice"));
    }

    @Test
    void resolvesBracketIndexes() {
        assertThat(query.lookup(root, "user.roles[1]").map(JsonNode::textValue)).contains("dev");
        assertThat(query.lookup(root, "events[0].id").map(JsonNode::intValue)).contains(1);
        assertThat(query.lookup(root, "events[0].tags[0][1]").map(JsonNode::textValue)).contains("y");
    }

    @Test
    void resolvesNumericDottedSegmentsAsIndexes() {
        assertThat(query.lookup(root, "events.1.id").map(JsonNode::intValue)).contains(2);
    }

    @Test
    void numericSegmentOnObjectIsMemberName() {
        assertThat(query.lookup(root, "7").map(JsonNode::textValue)).contains("numeric key");
    }

    @Test
    void escapedDotIsPartOfName() {
        assertThat(query.lookup(root, "a\\.b").map(JsonNode::textValue)).contains("dotted");
    }

    @Test
    void jsonNullIsPresent() {
        assertThat(query.lookup(root, "gone")).hasValueSatisfying(n -> assertThat(n.isNull()).isTrue());
    }

    @ParameterizedTest
    @ValueSource(strings = {"missing", "user.email", "user.roles[5]", "events[0].id.deeper", "user.name[0]",
            "events.9"})
    void absentPathsAreEmpty(String path) {
        assertThat(query.lookup(root, path)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", ".user", "user.", "user..name", "user.roles[", "user.roles[]", "user.roles[x]",
            "user.roles[0]name", "[0]", "user.[0]", "user\\"})
    void malformedPathsAreEmpty(String path) {
        assertThat(query.lookup(root, path)).isEmpty();
    }

    @Test
    void nullArgumentsAreEmpty() {
        assertThat(query.lookup(root, null)).isEmpty();
        assertThat(query.lookup(null, "user")).isEmpty();
    }
}
