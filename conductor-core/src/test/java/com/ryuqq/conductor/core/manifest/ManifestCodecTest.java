package com.ryuqq.conductor.core.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.conductor.core.model.Domain;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ManifestCodec 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ManifestCodecTest {

    private final ManifestCodec codec = new ManifestCodec();

    @Test
    void read_ValidTree_BindsEveryField() {
        // When
        OrchestraManifest manifest = codec.read(ManifestTrees.valid());

        // Then
        assertEquals("finance-orchestra", manifest.name());
        assertEquals(Domain.FINANCE, manifest.domain());
        assertEquals(1, manifest.agents().size());
        assertEquals("generate_invoice", manifest.tools().get(0).name());
        assertEquals(PolicyPrecedence.LEGAL, manifest.policies().get(0).precedence());
        assertTrue(manifest.policies().get(0).enforced());
        assertEquals(List.of(Domain.DATABASE), manifest.dependenciesOrEmpty());
        assertEquals("finance-team", manifest.metadata().author());
    }

    @Test
    void write_UsesWireIdentifiers() {
        // When
        JsonNode tree = codec.write(codec.read(ManifestTrees.valid()));

        // Then
        assertEquals("finance", tree.get("domain").asText());
        assertEquals("database", tree.get("dependencies").get(0).asText());
        assertEquals("legal", tree.get("policies").get(0).get("precedence").asText());
    }

    @Test
    void read_UnboundableTree_ThrowsIllegalArgument() {
        // Given
        var tree = ManifestTrees.valid();
        tree.put("domain", "payroll");

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> codec.read(tree));
    }
}
