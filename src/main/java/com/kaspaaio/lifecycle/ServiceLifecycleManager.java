package com.kaspaaio.lifecycle;

import com.kaspaaio.core.catalog.Profile;
import com.kaspaaio.core.catalog.ProfileCatalog;
import com.kaspaaio.core.catalog.ProfileIdMigration;
import com.kaspaaio.core.config.ComposeCodec;
import com.kaspaaio.core.config.ComposeDocument;
import com.kaspaaio.core.config.ComposeService;
import com.kaspaaio.core.error.AioException;
import com.kaspaaio.core.error.CompensationException;
import com.kaspaaio.core.error.EngineException;
import com.kaspaaio.core.error.StorageException;
import com.kaspaaio.core.metrics.AioMetrics;
import com.kaspaaio.core.store.AtomicFiles;
import com.kaspaaio.core.store.InstallationState;
import com.kaspaaio.core.store.InstallationStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Start, stop, deploy and remove service containers.
 *
 * <p>This class does not decide <em>what</em> should run; it carries out single
 * service operations for the reconciliation engine and the CLI. The one composite
 * operation, {@link #removeServices}, keeps containers, the compose document and
 * the installation state consistent with each other.
 */
@Service
public class ServiceLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(ServiceLifecycleManager.class);

    private final ProfileCatalog catalog;
    private final ContainerEngine engine;
    private final AioProperties properties;
    private final ComposeCodec composeCodec;
    private final InstallationStateRepository stateRepository;
    private final AioMetrics metrics;
    private final Clock clock;

    private final ConcurrentHashMap<String, CachedStatus> statusCache = new ConcurrentHashMap<>();

    @Autowired
    public ServiceLifecycleManager(ProfileCatalog catalog, ContainerEngine engine, AioProperties properties,
                                   ComposeCodec composeCodec, InstallationStateRepository stateRepository,
                                   @Autowired(required = false) AioMetrics metrics) {
        this(catalog, engine, properties, composeCodec, stateRepository, metrics, Clock.systemUTC());
    }

    public ServiceLifecycleManager(ProfileCatalog catalog, ContainerEngine engine, AioProperties properties,
                                   ComposeCodec composeCodec, InstallationStateRepository stateRepository,
                                   AioMetrics metrics, Clock clock) {
        this.catalog = catalog;
        this.engine = engine;
        this.properties = properties;
        this.composeCodec = composeCodec;
        this.stateRepository = stateRepository;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Container names of every service owned by the given profiles, deduplicated in
     * first-seen order. Legacy IDs are migrated; unknown IDs are logged and skipped.
     */
    public List<String> containerNamesForProfiles(Collection<String> profileIds) {
        var names = new LinkedHashSet<String>();
        for (String id : ProfileIdMigration.migrate(profileIds).profileIds()) {
            Optional<Profile> profile = catalog.find(id);
            if (profile.isEmpty()) {
                log.warn("Unknown profile '{}' ignored when resolving containers", id);
                continue;
            }
            names.addAll(profile.get().serviceNames());
        }
        return List.copyOf(names);
    }

    public void start(String containerName) {
        timed("start", containerName, () -> engine.start(containerName));
    }

    public void stop(String containerName) {
        timed("stop", containerName, () -> engine.stop(containerName, properties.getStopTimeoutSeconds()));
    }

    public void restart(String containerName) {
        timed("restart", containerName, () -> {
            engine.stop(containerName, properties.getStopTimeoutSeconds());
            engine.start(containerName);
        });
    }

    /**
     * Makes the image available (pull or local build), recreates the container and
     * starts it.
     *
     * @param timeout upper bound for the image pull or build
     */
    public void deploy(ComposeService service, Duration timeout) {
        timed("deploy", service.containerName(), () -> {
            ensureImage(service, timeout);
            service.networks().forEach(engine::ensureNetwork);
            engine.create(service, properties.getInstallRoot());
            engine.start(service.containerName());
        });
    }

    private void ensureImage(ComposeService service, Duration timeout) {
        if (service.build() != null) {
            Path context = properties.getInstallRoot().resolve(service.build().context()).normalize();
            if (!Files.isDirectory(context)) {
                throw new EngineException(service.containerName(), "Build context " + context + " does not exist");
            }
            engine.buildImage(context, service.build().dockerfile(), service.runImage(),
                    service.build().args(), timeout);
        } else {
            engine.pullImage(service.image(), timeout);
        }
    }

    /** Stops and removes one container without touching any file. */
    public void undeploy(String containerName) {
        timed("remove", containerName, () -> {
            engine.stop(containerName, properties.getStopTimeoutSeconds());
            engine.remove(containerName);
        });
    }

    /**
     * Removes services as one unit: containers first (in reverse document order),
     * then their compose blocks, then their entries in the installation state.
     *
     * <p>If a container cannot be removed, it is started again, the containers already
     * removed are redeployed and no file is touched. If a file cannot be written, the
     * previous compose bytes are written back and the removed containers are redeployed.
     * Callers must hold the reconciliation lock.
     *
     * @return the names removed, in removal order
     * @throws EngineException       if the engine refused a removal
     * @throws StorageException      if the compose document or state could not be written
     * @throws CompensationException if putting the services back failed too
     */
    public List<String> removeServices(Collection<String> containerNames) {
        Path composePath = properties.getComposePath();
        byte[] previousCompose = readBytes(composePath);
        ComposeDocument document = previousCompose != null
                ? composeCodec.read(new String(previousCompose, StandardCharsets.UTF_8))
                : ComposeDocument.empty();

        var order = new ArrayList<String>();
        for (String name : document.serviceNames()) {
            if (containerNames.contains(name)) order.add(0, name);
        }
        for (String name : containerNames) {
            if (!order.contains(name)) order.add(name);
        }

        var removed = new ArrayList<String>();
        String currentName = null;
        try {
            for (String name : order) {
                currentName = name;
                undeploy(name);
                removed.add(name);
            }
        } catch (EngineException e) {
            log.error("Removal of {} failed at {}; redeploying {}", order, currentName, removed);
            var unrecovered = new ArrayList<String>();
            // stop may have succeeded before remove failed
            if (!restartInPlace(currentName)) unrecovered.add(currentName);
            unrecovered.addAll(redeploy(removed, document));
            throw compensated(e, unrecovered);
        }

        try {
            AtomicFiles.write(composePath, composeCodec.write(document.without(removed)));
        } catch (IOException e) {
            throw compensated(new StorageException("compose_write_failed", "Cannot write " + composePath, e),
                    redeploy(removed, document));
        }

        try {
            InstallationState state = stateRepository.loadOrEmpty();
            stateRepository.save(state.withoutServices(removed, clock.instant()));
        } catch (StorageException e) {
            restoreCompose(composePath, previousCompose, e);
            throw compensated(e, redeploy(removed, document));
        }
        log.info("Removed services {}", removed);
        return removed;
    }

    private static AioException compensated(AioException failure, List<String> unrecovered) {
        return unrecovered.isEmpty() ? failure : new CompensationException(unrecovered, failure);
    }

    private boolean restartInPlace(String containerName) {
        try {
            start(containerName);
            return true;
        } catch (EngineException e) {
            log.error("Cannot start {} again after its removal failed: {}", containerName, e.getMessage(), e);
            return false;
        }
    }

    /** Redeploys removed services in reverse removal order and returns those that failed. */
    private List<String> redeploy(List<String> removed, ComposeDocument document) {
        var failed = new ArrayList<String>();
        for (int i = removed.size() - 1; i >= 0; i--) {
            String name = removed.get(i);
            Optional<ComposeService> service = document.service(name);
            if (service.isEmpty()) {
                log.warn("No compose block for {}; cannot redeploy it", name);
                continue;
            }
            try {
                deploy(service.get(), properties.getImageTimeout());
            } catch (EngineException e) {
                log.error("Compensating redeploy of {} failed: {}", name, e.getMessage(), e);
                failed.add(name);
            }
        }
        return failed;
    }

    private void restoreCompose(Path composePath, byte[] previous, Exception cause) {
        try {
            if (previous != null) {
                AtomicFiles.write(composePath, previous);
            } else {
                Files.deleteIfExists(composePath);
            }
        } catch (IOException e) {
            cause.addSuppressed(e);
            log.error("Cannot restore {} after a failed removal", composePath, e);
        }
    }

    private static byte[] readBytes(Path path) {
        try {
            return Files.isRegularFile(path) ? Files.readAllBytes(path) : null;
        } catch (IOException e) {
            throw new StorageException("compose_read_failed", "Cannot read " + path, e);
        }
    }

    /** The compose document currently on disk, or an empty one. */
    public ComposeDocument currentCompose() {
        byte[] bytes = readBytes(properties.getComposePath());
        return bytes != null
                ? composeCodec.read(new String(bytes, StandardCharsets.UTF_8))
                : ComposeDocument.empty();
    }

    /**
     * Runtime status of a container. Results are cached for the configured TTL so
     * dashboards polling many services do not hammer the daemon.
     */
    public ContainerStatus status(String containerName) {
        CachedStatus cached = statusCache.get(containerName);
        Instant now = clock.instant();
        if (cached != null && cached.cachedAt().plus(properties.getStatusCacheTtl()).isAfter(now)) {
            return cached.status();
        }
        ContainerStatus fresh = engine.inspect(containerName);
        statusCache.put(containerName, new CachedStatus(fresh, now));
        return fresh;
    }

    private record CachedStatus(ContainerStatus status, Instant cachedAt) {}

    public Map<String, ContainerStatus> statusAll(Collection<String> containerNames) {
        var statuses = new LinkedHashMap<String, ContainerStatus>();
        containerNames.forEach(name -> statuses.put(name, status(name)));
        return statuses;
    }

    private void timed(String operation, String containerName, Runnable action) {
        long start = System.currentTimeMillis();
        boolean success = false;
        try {
            action.run();
            success = true;
        } finally {
            statusCache.remove(containerName);
            if (metrics != null) {
                metrics.recordServiceOperation(operation, success, System.currentTimeMillis() - start);
            }
        }
    }
}
