package com.ryuqq.conductor.core.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.conductor.core.json.JsonSupport;

/**
 * Binds validated manifest trees to {@link OrchestraManifest} and back.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ManifestCodec {

    /**
     * Binds a tree that passed {@link ManifestValidator}.
     *
     * @param raw the validated tree
     * @return the bound manifest
     * @throws IllegalArgumentException if the tree cannot be bound
     */
    public OrchestraManifest read(JsonNode raw) {
        try {
            return JsonSupport.mapper().treeToValue(raw, OrchestraManifest.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Manifest could not be bound: " + e.getMessage(), e);
        }
    }

    /**
     * Renders a manifest as a tree.
     *
     * @param manifest the manifest
     * @return the tree
     */
    public JsonNode write(OrchestraManifest manifest) {
        return JsonSupport.toTree(manifest);
    }
}
