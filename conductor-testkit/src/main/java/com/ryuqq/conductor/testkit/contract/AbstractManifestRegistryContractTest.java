package com.ryuqq.conductor.testkit.contract;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.conductor.application.registry.ManifestRegistry;
import com.ryuqq.conductor.application.registry.RegistrationResult;
import com.ryuqq.conductor.core.manifest.ManifestStatus;
import com.ryuqq.conductor.core.manifest.RegistryEntry;
import com.ryuqq.conductor.core.model.Domain;
import com.ryuqq.conductor.testkit.fixture.ManifestFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract every {@link ManifestRegistry} implementation must satisfy.
 *
 * <p>Covers registration (overwrite, rejection without state change), lifecycle
 * (disable/enable), single-level dependency checks and per-domain write
 * serialization under concurrent access.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractManifestRegistryContractTest {

    protected ManifestRegistry registry;

    /**
     * Creates a fresh, empty registry for each test.
     */
    protected abstract ManifestRegistry createRegistry();

    @BeforeEach
    void setUpRegistry() {
        registry = createRegistry();
    }

    @AfterEach
    void tearDownRegistry() {
        if (registry != null) {
            registry.clear();
        }
    }

    @Test
    void register_ValidManifest_StoresActiveEntry() {
        // When
        RegistrationResult result = registry.register(ManifestFixtures.manifest(Domain.DATABASE));

        // Then
        assertTrue(result.success());
        assertEquals(64, result.manifestHash().length());
        assertTrue(result.errors().isEmpty());

        RegistryEntry entry = registry.getByDomain(Domain.DATABASE).orElseThrow();
        assertEquals(ManifestStatus.ACTIVE, entry.status());
        assertEquals(result.manifestHash(), entry.manifestHash());
        assertEquals("1.0.0", entry.manifest().version());
        assertTrue(registry.isActive(Domain.DATABASE));
    }

    @Test
    void register_SameDomainTwice_KeepsOnlySecondEntry() {
        // Given
        RegistrationResult first = registry.register(ManifestFixtures.manifest(Domain.FINANCE, "1.0.0"));

        // When
        RegistrationResult second = registry.register(ManifestFixtures.manifest(Domain.FINANCE, "1.1.0"));

        // Then
        assertTrue(second.success());
        assertNotEquals(first.manifestHash(), second.manifestHash());
        assertEquals(List.of(Domain.FINANCE), registry.listDomains());
        RegistryEntry entry = registry.getByDomain(Domain.FINANCE).orElseThrow();
        assertEquals("1.1.0", entry.manifest().version());
        assertEquals(second.manifestHash(), entry.manifestHash());
    }

    @Test
    void register_SameContentWithReorderedKeys_ProducesSameHash() {
        // Given
        ObjectNode manifest = ManifestFixtures.manifest(Domain.COMPLIANCE, Domain.DATABASE);

        // When
        RegistrationResult first = registry.register(manifest);
        RegistrationResult second = registry.register(ManifestFixtures.reorderKeys(manifest));

        // Then
        assertEquals(first.manifestHash(), second.manifestHash());
    }

    @Test
    void register_InvalidManifest_LeavesStateUnchanged() {
        // Given
        registry.register(ManifestFixtures.manifest(Domain.DATABASE, "1.0.0"));
        ObjectNode broken = ManifestFixtures.manifest(Domain.DATABASE, "2.0");
        broken.putArray("agents");

        // When
        RegistrationResult result = registry.register(broken);

        // Then
        assertFalse(result.success());
        assertNull(result.manifestHash());
        assertEquals(2, result.errors().size());
        assertTrue(result.error().startsWith("Manifest validation failed: "));
        assertEquals("1.0.0", registry.getByDomain(Domain.DATABASE).orElseThrow().manifest().version());
    }

    @Test
    void register_UnknownDomain_IsRejected() {
        // Given
        ObjectNode manifest = ManifestFixtures.manifest(Domain.DATABASE);
        manifest.put("domain", "payroll");

        // When
        RegistrationResult result = registry.register(manifest);

        // Then
        assertFalse(result.success());
        assertTrue(registry.listDomains().isEmpty());
    }

    @Test
    void getByDomain_Unregistered_ReturnsEmpty() {
        assertTrue(registry.getByDomain(Domain.DEVEX).isEmpty());
        assertFalse(registry.isActive(Domain.DEVEX));
    }

    @Test
    void disable_RegisteredDomain_MarksDisabledWithReason() {
        // Given
        registry.register(ManifestFixtures.manifest(Domain.OBSERVABILITY));

        // When
        boolean disabled = registry.disable(Domain.OBSERVABILITY, "maintenance");

        // Then
        assertTrue(disabled);
        RegistryEntry entry = registry.getByDomain(Domain.OBSERVABILITY).orElseThrow();
        assertEquals(ManifestStatus.DISABLED, entry.status());
        assertEquals("maintenance", entry.errorMessage());
        assertFalse(registry.isActive(Domain.OBSERVABILITY));
        assertTrue(registry.listActive().isEmpty());
    }

    @Test
    void disable_WithoutReason_UsesManualDisable() {
        // Given
        registry.register(ManifestFixtures.manifest(Domain.UX_UI));

        // When
        registry.disable(Domain.UX_UI, null);

        // Then
        assertEquals("Manual disable", registry.getByDomain(Domain.UX_UI).orElseThrow().errorMessage());
    }

    @Test
    void disable_UnregisteredDomain_ReturnsFalse() {
        assertFalse(registry.disable(Domain.FINANCE, "maintenance"));
        assertTrue(registry.getByDomain(Domain.FINANCE).isEmpty());
    }

    @Test
    void enable_DisabledDomain_RestoresActive() {
        // Given
        registry.register(ManifestFixtures.manifest(Domain.DEVEX));
        registry.disable(Domain.DEVEX, "maintenance");

        // When
        boolean enabled = registry.enable(Domain.DEVEX);

        // Then
        assertTrue(enabled);
        assertTrue(registry.isActive(Domain.DEVEX));
        assertNull(registry.getByDomain(Domain.DEVEX).orElseThrow().errorMessage());
    }

    @Test
    void enable_UnregisteredDomain_ReturnsFalse() {
        assertFalse(registry.enable(Domain.DEVEX));
    }

    @Test
    void listActive_OrdersByDomain() {
        // Given
        registry.register(ManifestFixtures.manifest(Domain.FINANCE));
        registry.register(ManifestFixtures.manifest(Domain.DATABASE));
        registry.register(ManifestFixtures.manifest(Domain.BFF_API));

        // When
        List<RegistryEntry> active = registry.listActive();

        // Then
        assertEquals(3, active.size());
        assertEquals(Domain.DATABASE, active.get(0).manifest().domain());
        assertEquals(Domain.BFF_API, active.get(1).manifest().domain());
        assertEquals(Domain.FINANCE, active.get(2).manifest().domain());
    }

    @Test
    void validateDependencies_AllDependenciesActive_ReturnsTrue() {
        // Given
        registry.register(ManifestFixtures.manifest(Domain.DATABASE));
        registry.register(ManifestFixtures.manifest(Domain.BFF_API, Domain.DATABASE));

        // Then
        assertEquals(List.of(Domain.DATABASE), registry.getDependencies(Domain.BFF_API));
        assertTrue(registry.validateDependencies(Domain.BFF_API));
        assertTrue(registry.getMissingDependencies(Domain.BFF_API).isEmpty());
    }

    @Test
    void validateDependencies_DependencyDisabledOrMissing_ReturnsFalse() {
        // Given
        registry.register(ManifestFixtures.manifest(Domain.DATABASE));
        registry.register(ManifestFixtures.manifest(Domain.COMPLIANCE, Domain.DATABASE, Domain.OBSERVABILITY));
        registry.disable(Domain.DATABASE, "maintenance");

        // Then
        assertFalse(registry.validateDependencies(Domain.COMPLIANCE));
        assertEquals(List.of(Domain.DATABASE, Domain.OBSERVABILITY),
            registry.getMissingDependencies(Domain.COMPLIANCE));
    }

    @Test
    void validateDependencies_NoDeclaredDependencies_ReturnsTrue() {
        // Given
        registry.register(ManifestFixtures.manifest(Domain.DATABASE));

        // Then
        assertTrue(registry.getDependencies(Domain.DATABASE).isEmpty());
        assertTrue(registry.validateDependencies(Domain.DATABASE));
    }

    @Test
    void getDependencies_UnregisteredDomain_ReturnsEmpty() {
        assertTrue(registry.getDependencies(Domain.FINANCE).isEmpty());
    }

    @Test
    void concurrentWritesAndReads_SameDomain_ReadersSeeWholeEntries() throws Exception {
        // Given
        int writers = 4;
        int rounds = 25;
        Map<String, String> hashByVersion = new ConcurrentHashMap<>();
        RegistrationResult initial = registry.register(ManifestFixtures.manifest(Domain.FINANCE, "0.0.1"));
        hashByVersion.put("0.0.1", initial.manifestHash());
        Queue<RegistryEntry> observed = new ConcurrentLinkedQueue<>();
        ExecutorService pool = Executors.newFixedThreadPool(writers + 2);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch writersDone = new CountDownLatch(writers);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        for (int round = 0; round < rounds; round++) {
                            String version = "1." + writer + "." + round;
                            RegistrationResult result =
                                registry.register(ManifestFixtures.manifest(Domain.FINANCE, version));
                            assertTrue(result.success());
                            hashByVersion.put(version, result.manifestHash());
                            registry.disable(Domain.FINANCE, "maintenance-" + writer);
                            registry.enable(Domain.FINANCE);
                        }
                    } finally {
                        writersDone.countDown();
                    }
                    return null;
                }));
            }
            for (int r = 0; r < 2; r++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    while (writersDone.getCount() > 0) {
                        registry.getByDomain(Domain.FINANCE).ifPresent(observed::add);
                        registry.isActive(Domain.FINANCE);
                    }
                    return null;
                }));
            }

            // When
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // Then
        for (RegistryEntry entry : observed) {
            assertEquals(hashByVersion.get(entry.manifest().version()), entry.manifestHash(),
                "hash must belong to the manifest it is stored with");
            if (entry.status() == ManifestStatus.DISABLED) {
                assertNotNull(entry.errorMessage());
                assertTrue(entry.errorMessage().startsWith("maintenance-"));
            } else {
                assertEquals(ManifestStatus.ACTIVE, entry.status());
                assertNull(entry.errorMessage());
            }
        }
        assertEquals(List.of(Domain.FINANCE), registry.listDomains());
        assertEquals(writers * rounds + 1, hashByVersion.size());
    }

    @Test
    void clear_RemovesEveryEntry() {
        // Given
        registry.register(ManifestFixtures.manifest(Domain.DATABASE));
        registry.register(ManifestFixtures.manifest(Domain.FINANCE));

        // When
        registry.clear();

        // Then
        assertTrue(registry.listDomains().isEmpty());
        assertTrue(registry.listActive().isEmpty());
    }
}
