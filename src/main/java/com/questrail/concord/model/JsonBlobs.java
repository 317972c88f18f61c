package com.questrail.concord.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Deep copies of the JSON-shaped maps carried by sessions and proposals.
 *
 * <p>The copy goes through a Jackson tree, so nested maps and lists are never
 * shared with the source. Integral and floating values keep their Java types.
 * Values Jackson cannot serialize are rejected with
 * {@link IllegalArgumentException}.</p>
 */
public final class JsonBlobs
{
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JavaType MAP_TYPE =
            MAPPER.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, Object.class);

    private JsonBlobs() {}

    /**
     * @return a mutable, insertion-ordered copy sharing no nested containers with {@code blob}
     */
    public static Map<String, Object> deepCopy(Map<String, Object> blob) {
        Objects.requireNonNull(blob, "blob");
        JsonNode tree = MAPPER.valueToTree(blob);
        try {
            return MAPPER.treeToValue(tree, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a JSON object: " + e.getOriginalMessage(), e);
        }
    }
}
