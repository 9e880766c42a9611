package com.ryuqq.conductor.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.conductor.core.json.JsonSupport;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Arguments 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ArgumentsTest {

    @Test
    void of_MixedValues_KeepsJsonTypes() {
        // When
        Arguments arguments = Arguments.of(Map.of(
            "table", "invoices",
            "limit", 50,
            "dryRun", true,
            "columns", List.of("id", "amount")));

        // Then
        assertEquals("invoices", arguments.getString("table").orElseThrow());
        assertEquals(50, arguments.get("limit").orElseThrow().intValue());
        assertTrue(arguments.get("dryRun").orElseThrow().booleanValue());
        assertTrue(arguments.get("columns").orElseThrow().isArray());
        assertTrue(arguments.getString("limit").isEmpty());
    }

    @Test
    void of_NullOrEmpty_ReturnsEmpty() {
        assertTrue(Arguments.of((Map<String, ?>) null).isEmpty());
        assertTrue(Arguments.of(Map.of()).isEmpty());
        assertSame(Arguments.empty(), Arguments.of((JsonNode) null));
    }

    @Test
    void of_NonObjectNode_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> Arguments.of(JsonSupport.mapper().createArrayNode()));
    }

    @Test
    void of_ObjectNode_IsDefensivelyCopied() {
        // Given
        ObjectNode source = JsonSupport.newObject().put("id", "inv-1");
        Arguments arguments = Arguments.of(source);

        // When
        source.put("id", "changed");
        arguments.asJson().put("id", "changed-too");

        // Then
        assertEquals("inv-1", arguments.getString("id").orElseThrow());
    }

    @Test
    void asMap_ConvertsToPlainValues() {
        // Given
        Arguments arguments = Arguments.of(Map.of("limit", 5, "nested", Map.of("k", "v")));

        // When
        Map<String, Object> map = arguments.asMap();

        // Then
        assertEquals(5, map.get("limit"));
        assertEquals(Map.of("k", "v"), map.get("nested"));
    }

    @Test
    void equals_SameContent_AreEqual() {
        assertEquals(Arguments.of(Map.of("a", 1)), Arguments.of(Map.of("a", 1)));
        assertNotEquals(Arguments.of(Map.of("a", 1)), Arguments.of(Map.of("a", 2)));
    }
}
