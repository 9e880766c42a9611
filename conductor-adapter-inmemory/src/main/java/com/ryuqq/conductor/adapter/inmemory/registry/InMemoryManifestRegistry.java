package com.ryuqq.conductor.adapter.inmemory.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.conductor.application.registry.ManifestRegistry;
import com.ryuqq.conductor.application.registry.RegistrationResult;
import com.ryuqq.conductor.core.manifest.ManifestCodec;
import com.ryuqq.conductor.core.manifest.ManifestHasher;
import com.ryuqq.conductor.core.manifest.ManifestStatus;
import com.ryuqq.conductor.core.manifest.ManifestValidator;
import com.ryuqq.conductor.core.manifest.OrchestraManifest;
import com.ryuqq.conductor.core.manifest.RegistryEntry;
import com.ryuqq.conductor.core.model.Domain;
import com.ryuqq.conductor.core.telemetry.SideChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link ManifestRegistry}.
 *
 * <p>Entries are immutable {@link RegistryEntry} records kept in a {@link ConcurrentHashMap}
 * keyed by domain. Every write goes through {@link ConcurrentHashMap#compute}, so writes to the
 * same domain are serialized and readers always see a whole entry.</p>
 *
 * <p><strong>Registration Flow:</strong></p>
 * <ol>
 *   <li>Structural validation ({@link ManifestValidator}) - all errors reported at once</li>
 *   <li>Binding ({@link ManifestCodec})</li>
 *   <li>Content hash ({@link ManifestHasher})</li>
 *   <li>Entry replaced with status ACTIVE</li>
 *   <li>Audit, event and metrics through the {@link SideChannel}</li>
 * </ol>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Dependency checks are single level (no transitive walk)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryManifestRegistry implements ManifestRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryManifestRegistry.class);

    private static final String DEFAULT_DISABLE_REASON = "Manual disable";

    private final ConcurrentHashMap<Domain, RegistryEntry> entries;
    private final ManifestValidator validator;
    private final ManifestCodec codec;
    private final ManifestHasher hasher;
    private final SideChannel sideChannel;

    /**
     * Creates a registry that records nothing on the side channel.
     */
    public InMemoryManifestRegistry() {
        this(SideChannel.noop());
    }

    /**
     * Creates a registry.
     *
     * @param sideChannel audit/event/metrics channel
     * @throws IllegalArgumentException if sideChannel is null
     */
    public InMemoryManifestRegistry(SideChannel sideChannel) {
        if (sideChannel == null) {
            throw new IllegalArgumentException("sideChannel cannot be null");
        }
        this.entries = new ConcurrentHashMap<>();
        this.validator = new ManifestValidator();
        this.codec = new ManifestCodec();
        this.hasher = new ManifestHasher();
        this.sideChannel = sideChannel;
    }

    @Override
    public RegistrationResult register(JsonNode rawManifest) {
        List<String> errors = validator.validate(rawManifest);
        if (!errors.isEmpty()) {
            String domainId = rawManifest != null && rawManifest.hasNonNull("domain")
                ? rawManifest.get("domain").asText()
                : null;
            log.warn("Manifest registration rejected for {}: {}", domainId, errors);
            sideChannel.manifestRejected(domainId, errors);
            return RegistrationResult.rejected(errors);
        }

        OrchestraManifest manifest;
        try {
            manifest = codec.read(rawManifest);
        } catch (IllegalArgumentException e) {
            List<String> bindErrors = List.of(e.getMessage());
            sideChannel.manifestRejected(rawManifest.get("domain").asText(), bindErrors);
            return RegistrationResult.rejected(bindErrors);
        }
        return store(manifest);
    }

    /**
     * {@inheritDoc}
     *
     * <p>The manifest is rendered back to a tree and validated like a raw submission.</p>
     */
    @Override
    public RegistrationResult register(OrchestraManifest manifest) {
        if (manifest == null) {
            return register((JsonNode) null);
        }
        return register(codec.write(manifest));
    }

    private RegistrationResult store(OrchestraManifest manifest) {
        String hash = hasher.hash(manifest);
        RegistryEntry entry = RegistryEntry.active(manifest, hash, Instant.now());
        AtomicReference<RegistryEntry> replaced = new AtomicReference<>();
        entries.compute(manifest.domain(), (key, current) -> {
            replaced.set(current);
            return entry;
        });

        RegistryEntry previous = replaced.get();
        if (previous != null) {
            log.info("Orchestra manifest replaced: domain={}, version={} -> {}, hash={}",
                manifest.domain(), previous.manifest().version(), manifest.version(), hash);
        } else {
            log.info("Orchestra manifest registered: domain={}, version={}, hash={}",
                manifest.domain(), manifest.version(), hash);
        }
        sideChannel.manifestRegistered(manifest, hash);
        sideChannel.activeOrchestras(countActive());
        return RegistrationResult.registered(hash);
    }

    @Override
    public Optional<RegistryEntry> getByDomain(Domain domain) {
        if (domain == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(domain));
    }

    @Override
    public List<RegistryEntry> listActive() {
        return entries.values().stream()
            .filter(RegistryEntry::isActive)
            .sorted((a, b) -> a.manifest().domain().compareTo(b.manifest().domain()))
            .toList();
    }

    @Override
    public List<Domain> listDomains() {
        return entries.keySet().stream().sorted().toList();
    }

    @Override
    public boolean disable(Domain domain, String reason) {
        if (domain == null) {
            return false;
        }
        String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_DISABLE_REASON : reason;
        AtomicBoolean found = new AtomicBoolean(false);
        entries.computeIfPresent(domain, (key, current) -> {
            found.set(true);
            return current.withStatus(ManifestStatus.DISABLED, effectiveReason);
        });
        if (!found.get()) {
            log.debug("Disable ignored, orchestra not registered: {}", domain);
            return false;
        }
        log.warn("Orchestra disabled: domain={}, reason={}", domain, effectiveReason);
        sideChannel.manifestDisabled(domain, effectiveReason);
        sideChannel.activeOrchestras(countActive());
        return true;
    }

    @Override
    public boolean enable(Domain domain) {
        if (domain == null) {
            return false;
        }
        AtomicReference<RegistryEntry> updated = new AtomicReference<>();
        entries.computeIfPresent(domain, (key, current) -> {
            RegistryEntry next = current.withStatus(ManifestStatus.ACTIVE, null);
            updated.set(next);
            return next;
        });
        if (updated.get() == null) {
            return false;
        }
        log.info("Orchestra enabled: domain={}", domain);
        sideChannel.manifestEnabled(updated.get().manifest());
        sideChannel.activeOrchestras(countActive());
        return true;
    }

    @Override
    public boolean isActive(Domain domain) {
        return getByDomain(domain).map(RegistryEntry::isActive).orElse(false);
    }

    @Override
    public List<Domain> getDependencies(Domain domain) {
        return getByDomain(domain)
            .map(entry -> entry.manifest().dependenciesOrEmpty())
            .orElse(List.of());
    }

    @Override
    public boolean validateDependencies(Domain domain) {
        return getMissingDependencies(domain).isEmpty();
    }

    @Override
    public List<Domain> getMissingDependencies(Domain domain) {
        return getDependencies(domain).stream()
            .filter(dependency -> !isActive(dependency))
            .toList();
    }

    @Override
    public void clear() {
        entries.clear();
        sideChannel.activeOrchestras(0);
    }

    private int countActive() {
        return (int) entries.values().stream().filter(RegistryEntry::isActive).count();
    }
}
