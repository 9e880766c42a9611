/**
 * Orchestra manifest model, structural validation and content hashing.
 *
 * <p>Raw manifests arrive as Jackson trees. {@link com.ryuqq.conductor.core.manifest.ManifestValidator}
 * reports every structural error at once; only a valid tree is bound by
 * {@link com.ryuqq.conductor.core.manifest.ManifestCodec} and hashed by
 * {@link com.ryuqq.conductor.core.manifest.ManifestHasher}.</p>
 *
 * <h2>Content Hash</h2>
 * <p>SHA-256 over the canonical JSON form: object keys sorted at every depth, array order kept,
 * no insignificant whitespace. Reordering keys never changes the hash.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.manifest;
