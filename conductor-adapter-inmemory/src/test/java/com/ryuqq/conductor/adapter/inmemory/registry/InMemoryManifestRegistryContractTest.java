package com.ryuqq.conductor.adapter.inmemory.registry;

import com.ryuqq.conductor.application.registry.ManifestRegistry;
import com.ryuqq.conductor.testkit.contract.AbstractManifestRegistryContractTest;

/**
 * Contract tests for {@link InMemoryManifestRegistry}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryManifestRegistryContractTest extends AbstractManifestRegistryContractTest {

    @Override
    protected ManifestRegistry createRegistry() {
        return new InMemoryManifestRegistry();
    }
}
