package io.eventmatch.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * Path-query SPI used by the {@code exists} and {@code safe} expression functions to reach nested
 * values of the raw event document.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe, and MUST NOT throw for missing or malformed
 * paths: an unreachable path is simply empty.
 */
public interface PathQuery {

    /**
     * Resolves {@code path} against {@code root}.
     *
     * @param root the parsed document
     * @param path a dotted/bracket path such as {@code a.b[0].c}
     * @return the node at {@code path} (possibly a JSON {@code null} node), or empty if the path is
     *     absent or malformed
     */
    Optional<JsonNode> lookup(JsonNode root, String path);
}
