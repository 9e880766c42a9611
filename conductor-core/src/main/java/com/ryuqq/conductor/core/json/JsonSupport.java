package com.ryuqq.conductor.core.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared Jackson mapper for manifests, arguments and result payloads.
 *
 * <p>Unknown manifest properties are tolerated so that manifests written for newer
 * kernels still register; structural checks live in the manifest validator.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JsonSupport {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonSupport() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Returns the shared mapper. Callers must not reconfigure it.
     *
     * @return the shared ObjectMapper
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Converts an arbitrary value (map, record, list...) into a JSON tree.
     *
     * @param value the value, may be null
     * @return the tree, {@code NullNode} for null
     * @throws IllegalArgumentException if the value cannot be represented as JSON
     */
    public static JsonNode toTree(Object value) {
        return MAPPER.valueToTree(value);
    }

    /**
     * Creates an empty object node.
     *
     * @return a new ObjectNode
     */
    public static ObjectNode newObject() {
        return MAPPER.createObjectNode();
    }
}
