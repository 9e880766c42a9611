package com.ryuqq.conductor.core.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.conductor.core.json.JsonSupport;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;

/**
 * Content hash of a manifest.
 *
 * <p>The manifest is canonicalized recursively before hashing: object keys are sorted at every
 * nesting level, array order is preserved. Two manifests that differ only in key insertion order
 * therefore hash identically, which is what makes the hash usable for change detection.</p>
 *
 * <p><strong>Format:</strong> SHA-256 over the compact UTF-8 JSON of the canonical tree,
 * rendered as 64 lowercase hex characters.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ManifestHasher {

    private static final String ALGORITHM = "SHA-256";

    /**
     * Hashes a bound manifest.
     *
     * @param manifest the manifest
     * @return 64-character lowercase hex digest
     * @throws IllegalArgumentException if manifest is null
     */
    public String hash(OrchestraManifest manifest) {
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        return hash(JsonSupport.toTree(manifest));
    }

    /**
     * Hashes an arbitrary JSON tree after canonicalization.
     *
     * @param tree the tree
     * @return 64-character lowercase hex digest
     * @throws IllegalArgumentException if tree is null
     */
    public String hash(JsonNode tree) {
        if (tree == null) {
            throw new IllegalArgumentException("tree cannot be null");
        }
        String canonical;
        try {
            canonical = JsonSupport.mapper().writeValueAsString(canonicalize(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize canonical manifest", e);
        }
        return HexFormat.of().formatHex(digest().digest(canonical.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Returns a copy of the tree with object keys sorted at every depth.
     *
     * @param node the tree
     * @return the canonical copy
     */
    public JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> iterator = node.fieldNames();
            while (iterator.hasNext()) {
                names.add(iterator.next());
            }
            names.sort(null);
            ObjectNode sorted = JsonSupport.newObject();
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode copy = JsonSupport.mapper().createArrayNode();
            for (JsonNode element : node) {
                copy.add(canonicalize(element));
            }
            return copy;
        }
        return node;
    }

    private MessageDigest digest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }
}
