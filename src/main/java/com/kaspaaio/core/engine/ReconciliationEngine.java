package com.kaspaaio.core.engine;

import com.kaspaaio.core.catalog.ProfileCatalog;
import com.kaspaaio.core.catalog.ProfileIdMigration;
import com.kaspaaio.core.catalog.ServiceRef;
import com.kaspaaio.core.catalog.SettingField;
import com.kaspaaio.core.catalog.StartupPhase;
import com.kaspaaio.core.config.ComposeDocument;
import com.kaspaaio.core.config.ConfigGenerator;
import com.kaspaaio.core.config.EnvFile;
import com.kaspaaio.core.config.GeneratedConfiguration;
import com.kaspaaio.core.config.SettingsSchema;
import com.kaspaaio.core.error.AioError;
import com.kaspaaio.core.error.AioException;
import com.kaspaaio.core.error.CompensationException;
import com.kaspaaio.core.error.EngineException;
import com.kaspaaio.core.error.ErrorKind;
import com.kaspaaio.core.error.Result;
import com.kaspaaio.core.error.StorageException;
import com.kaspaaio.core.events.AioEvent;
import com.kaspaaio.core.events.EventBus;
import com.kaspaaio.core.logging.MdcContext;
import com.kaspaaio.core.metrics.AioMetrics;
import com.kaspaaio.core.security.SecretMaterialFilter;
import com.kaspaaio.core.store.AtomicFiles;
import com.kaspaaio.core.store.ConfigurationSnapshot;
import com.kaspaaio.core.store.HistoryEntry;
import com.kaspaaio.core.store.InstallationState;
import com.kaspaaio.core.store.InstallationStateRepository;
import com.kaspaaio.core.store.VersionStore;
import com.kaspaaio.core.validation.DependencyValidator;
import com.kaspaaio.core.validation.IssueCode;
import com.kaspaaio.core.validation.ValidationIssue;
import com.kaspaaio.core.validation.ValidationResult;
import com.kaspaaio.lifecycle.AioProperties;
import com.kaspaaio.lifecycle.ServiceLifecycleManager;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Applies a desired profile selection to the installation.
 *
 * <p>A run validates the request, snapshots the current files, generates the new
 * configuration, diffs it against what is on disk and applies the difference to the
 * running containers. Only one run may be between snapshotting and commit at a time;
 * a second caller is turned away rather than queued. Any failure while applying
 * restores the snapshot and re-applies the old document. If that also fails the run
 * ends in {@link ReconciliationState#MANUAL_RECOVERY_REQUIRED} and nothing is retried.
 *
 * <p>Removals are applied phase by phase in reverse startup order, additions and
 * changes in forward order. Services of the same phase are handled in parallel.
 */
@Service
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);
    private static final DateTimeFormatter ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final ProfileCatalog catalog;
    private final DependencyValidator validator;
    private final ConfigGenerator configGenerator;
    private final SettingsSchema schema;
    private final SecretMaterialFilter secretFilter;
    private final VersionStore versionStore;
    private final ServiceLifecycleManager lifecycle;
    private final InstallationStateRepository stateRepository;
    private final AioProperties properties;
    private final EventBus eventBus;
    private final AioMetrics metrics;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final ExecutorService executor;
    private volatile Run current;
    private volatile ReconciliationOutcome lastOutcome;

    @Autowired
    public ReconciliationEngine(ProfileCatalog catalog, DependencyValidator validator,
                                ConfigGenerator configGenerator, SettingsSchema schema,
                                SecretMaterialFilter secretFilter, VersionStore versionStore,
                                ServiceLifecycleManager lifecycle, InstallationStateRepository stateRepository,
                                AioProperties properties, EventBus eventBus,
                                @Autowired(required = false) AioMetrics metrics) {
        this(catalog, validator, configGenerator, schema, secretFilter, versionStore, lifecycle, stateRepository,
                properties, eventBus, metrics, Clock.systemUTC());
    }

    public ReconciliationEngine(ProfileCatalog catalog, DependencyValidator validator,
                                ConfigGenerator configGenerator, SettingsSchema schema,
                                SecretMaterialFilter secretFilter, VersionStore versionStore,
                                ServiceLifecycleManager lifecycle, InstallationStateRepository stateRepository,
                                AioProperties properties, EventBus eventBus, AioMetrics metrics, Clock clock) {
        this.catalog = catalog;
        this.validator = validator;
        this.configGenerator = configGenerator;
        this.schema = schema;
        this.secretFilter = secretFilter;
        this.versionStore = versionStore;
        this.lifecycle = lifecycle;
        this.stateRepository = stateRepository;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        var workers = new AtomicInteger(0);
        this.executor = Executors.newFixedThreadPool(properties.getMaxParallel(), r -> {
            Thread t = new Thread(r, "reconcile-worker-" + workers.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // -- reconcile --------------------------------------------------------------------

    public ReconciliationOutcome reconcile(ReconfigurationRequest request) {
        Run run = new Run(nextId(), request.reason());
        return execute(run, Map.of("profiles", request.profiles(), "reason", request.reason()), () -> {
            run.transition(ReconciliationState.VALIDATING, "Validating selection " + request.profiles());
            var errors = new ArrayList<AioError>();
            errors.addAll(rejectSecretMaterial(request.settings()));
            ValidationResult validation = validator.validateSelection(request.profiles());
            validation.errors().forEach(e -> errors.add(e.toError()));
            validation.warnings().forEach(w -> run.warnings.add(w.message()));
            run.resolvedProfiles = validation.resolvedProfiles();
            if (!errors.isEmpty()) {
                return run.finish(ReconciliationState.FAILED, errors);
            }
            return locked(run, () -> reconcileLocked(run, request));
        });
    }

    private ReconciliationOutcome reconcileLocked(Run run, ReconfigurationRequest request) {
        InstallationState previous;
        ComposeDocument oldCompose;
        Map<String, String> oldEnv;
        GeneratedConfiguration generated;
        try {
            previous = stateRepository.loadOrEmpty();
            oldCompose = lifecycle.currentCompose();
            oldEnv = versionStore.readContents(VersionStore.CURRENT).env();

            run.transition(ReconciliationState.SNAPSHOTTING, "Backing up current configuration");
            run.snapshotId = snapshot(run, request.reason()).id();

            run.transition(ReconciliationState.GENERATING, "Generating configuration for " + run.resolvedProfiles);
            var settings = new LinkedHashMap<String, String>(previous.isInstalled() ? previous.configuration() : oldEnv);
            settings.putAll(request.settings());
            Result<GeneratedConfiguration> result = configGenerator.generate(run.resolvedProfiles, settings);
            if (result instanceof Result.Failure<GeneratedConfiguration> failure) {
                return run.finish(ReconciliationState.FAILED, failure.errors());
            }
            generated = result.orElseThrow();
            run.warnings.addAll(generated.warnings());
        } catch (AioException e) {
            log.error("Reconfiguration {} rejected: {}", run.id, e.getMessage(), e);
            return run.finish(ReconciliationState.FAILED, List.of(e.getError()));
        } catch (IllegalArgumentException e) {
            return run.finish(ReconciliationState.FAILED, List.of(AioError.storage("corrupt_configuration",
                    "Current configuration files are malformed: " + e.getMessage())));
        }

        run.transition(ReconciliationState.DIFFING, "Comparing with the configuration on disk");
        ServiceDiff diff = ServiceDiff.between(oldCompose, generated.compose(), oldEnv, generated.env());
        run.diff = diff;
        log.info("Diff: added {}, removed {}, changed {}, {} keys changed",
                diff.added(), diff.removed(), diff.changed(), diff.changedKeys().size());

        run.transition(ReconciliationState.APPLYING, "Applying " + diff.touched() + " service changes");
        try {
            writeConfiguration(generated);
            applyContainers(run, generated.compose(), diff);

            String action = previous.isInstalled() ? "reconfigure" : "install";
            var entry = historyEntry(action, run, diff);
            stateRepository.save(previous.commit(run.resolvedProfiles, generated.env(),
                    generated.compose().serviceNames(), entry));
        } catch (AioException e) {
            return rollback(run, oldCompose, diff, e);
        }
        return commit(run);
    }

    private List<AioError> rejectSecretMaterial(Map<String, String> settings) {
        Set<String> secretKeys = catalog.fields().values().stream()
                .filter(SettingField::isSecret)
                .map(SettingField::key)
                .collect(Collectors.toSet());
        return secretFilter.inspect(settings, secretKeys).stream()
                .map(r -> AioError.validation("secret_material",
                                "Setting " + r.key() + " rejected: value " + r.reason(),
                                "Never put wallet keys or seed phrases into the configuration")
                        .withDetails(Map.of("field", r.key())))
                .toList();
    }

    private void writeConfiguration(GeneratedConfiguration generated) {
        try {
            AtomicFiles.write(properties.getComposePath(), generated.composeYaml());
            AtomicFiles.write(properties.getEnvPath(), generated.envFile());
        } catch (IOException e) {
            throw new StorageException("config_write_failed", "Cannot write configuration files", e);
        }
    }

    // -- restore ----------------------------------------------------------------------

    /**
     * Restores a backup and converges the containers to it. A backup of the current
     * state is taken first; the restore is recorded as a {@code restore} history entry.
     */
    public ReconciliationOutcome restore(String backupId) {
        Run run = new Run(nextId(), "restore " + backupId);
        return execute(run, Map.of("backupId", backupId), () -> {
            run.transition(ReconciliationState.VALIDATING, "Checking backup " + backupId);
            if (versionStore.getBackup(backupId).isEmpty()) {
                return run.finish(ReconciliationState.FAILED, List.of(AioError.validation("backup_not_found",
                        "Backup not found: " + backupId, "List backups to find a valid ID")));
            }
            return locked(run, () -> restoreLocked(run, backupId));
        });
    }

    private ReconciliationOutcome restoreLocked(Run run, String backupId) {
        ComposeDocument oldCompose;
        Map<String, String> oldEnv;
        try {
            oldCompose = lifecycle.currentCompose();
            oldEnv = versionStore.readContents(VersionStore.CURRENT).env();
            run.transition(ReconciliationState.SNAPSHOTTING, "Backing up current configuration");
            run.snapshotId = snapshot(run, "pre-restore").id();
        } catch (AioException e) {
            return run.finish(ReconciliationState.FAILED, List.of(e.getError()));
        } catch (IllegalArgumentException e) {
            return run.finish(ReconciliationState.FAILED, List.of(AioError.storage("corrupt_configuration",
                    "Current configuration files are malformed: " + e.getMessage())));
        }

        ServiceDiff diff = ServiceDiff.empty();
        try {
            List<HistoryEntry> history = stateRepository.loadOrEmpty().history();
            run.transition(ReconciliationState.GENERATING, "Restoring files of backup " + backupId);
            versionStore.restoreBackup(backupId, false);
            ComposeDocument restored = lifecycle.currentCompose();
            Map<String, String> restoredEnv = versionStore.readContents(VersionStore.CURRENT).env();
            // the backup carries the history as it was then; keep the current one
            InstallationState restoredState = stateRepository.loadOrEmpty();
            InstallationState state = new InstallationState(restoredState.mode(), restoredState.selectedProfiles(),
                    restoredState.configuration(), restoredState.services(), restoredState.lastModified(), history);
            run.resolvedProfiles = state.selectedProfiles();

            run.transition(ReconciliationState.DIFFING, "Comparing restored configuration with running services");
            diff = ServiceDiff.between(oldCompose, restored, oldEnv, restoredEnv);
            run.diff = diff;

            run.transition(ReconciliationState.APPLYING, "Applying " + diff.touched() + " service changes");
            applyContainers(run, restored, diff);
            stateRepository.save(state.commit(state.selectedProfiles(), state.configuration(),
                    restored.serviceNames(), historyEntry("restore", run, diff)));
        } catch (AioException e) {
            return rollback(run, oldCompose, diff, e);
        } catch (IllegalArgumentException e) {
            return rollback(run, oldCompose, diff, new StorageException("corrupt_backup",
                    "Backup " + backupId + " contains malformed files: " + e.getMessage(), e));
        }
        return commit(run);
    }

    // -- remove profiles --------------------------------------------------------------

    /**
     * Removes installed profiles together with the services no remaining profile owns.
     */
    public ReconciliationOutcome removeProfiles(Collection<String> profileIds) {
        List<String> targets = ProfileIdMigration.migrate(profileIds).profileIds();
        Run run = new Run(nextId(), "remove " + String.join(", ", targets));
        return execute(run, Map.of("remove", targets), () -> {
            run.transition(ReconciliationState.VALIDATING, "Checking removal of " + targets);
            if (targets.isEmpty()) {
                return run.finish(ReconciliationState.FAILED, List.of(ValidationIssue.of(IssueCode.EMPTY_SELECTION,
                        "No profiles to remove", "Name at least one installed profile", Map.of()).toError()));
            }
            InstallationState state;
            try {
                state = stateRepository.loadOrEmpty();
            } catch (AioException e) {
                return run.finish(ReconciliationState.FAILED, List.of(e.getError()));
            }
            var errors = new ArrayList<AioError>();
            run.resolvedProfiles = remainingAfterRemoval(targets, state.selectedProfiles(), errors);
            if (!errors.isEmpty()) {
                return run.finish(ReconciliationState.FAILED, errors);
            }
            return locked(run, () -> removeLocked(run, targets));
        });
    }

    /**
     * Removes targets one at a time until none is left or no further target can be
     * removed, so the order in which dependent profiles are named does not matter.
     */
    private List<String> remainingAfterRemoval(List<String> targets, List<String> installed, List<AioError> errors) {
        var remaining = new ArrayList<>(installed);
        var pending = new ArrayList<>(targets);
        boolean progress = true;
        while (!pending.isEmpty() && progress) {
            progress = false;
            for (String target : List.copyOf(pending)) {
                ValidationResult result = validator.validateRemoval(target, remaining);
                if (result.valid()) {
                    remaining = new ArrayList<>(result.resolvedProfiles());
                    pending.remove(target);
                    progress = true;
                }
            }
        }
        for (String target : pending) {
            validator.validateRemoval(target, remaining).errors().forEach(e -> errors.add(e.toError()));
        }
        return remaining;
    }

    private ReconciliationOutcome removeLocked(Run run, List<String> targets) {
        InstallationState previous;
        ComposeDocument oldCompose;
        Map<String, String> oldEnv;
        try {
            previous = stateRepository.loadOrEmpty();
            oldCompose = lifecycle.currentCompose();
            oldEnv = versionStore.readContents(VersionStore.CURRENT).env();
            run.transition(ReconciliationState.SNAPSHOTTING, "Backing up current configuration");
            run.snapshotId = snapshot(run, "remove-profile").id();
        } catch (AioException e) {
            return run.finish(ReconciliationState.FAILED, List.of(e.getError()));
        } catch (IllegalArgumentException e) {
            return run.finish(ReconciliationState.FAILED, List.of(AioError.storage("corrupt_configuration",
                    "Current configuration files are malformed: " + e.getMessage())));
        }

        run.transition(ReconciliationState.GENERATING, "Computing configuration for " + run.resolvedProfiles);
        Set<String> relevant = schema.relevantFields(run.resolvedProfiles).keySet();
        var configuration = new TreeMap<String, String>();
        previous.configuration().forEach((k, v) -> {
            if (relevant.contains(k)) configuration.put(k, v);
        });

        run.transition(ReconciliationState.DIFFING, "Selecting services owned only by " + targets);
        Set<String> kept = catalog.servicesFor(run.resolvedProfiles).stream()
                .map(ServiceRef::name)
                .collect(Collectors.toSet());
        var removed = new ArrayList<String>();
        for (String name : oldCompose.serviceNames()) {
            if (!kept.contains(name)) removed.add(name);
        }
        for (String name : lifecycle.containerNamesForProfiles(targets)) {
            if (!kept.contains(name) && !removed.contains(name)) removed.add(name);
        }
        var unchanged = oldCompose.serviceNames().stream().filter(kept::contains).toList();
        var diff = new ServiceDiff(List.of(), removed, List.of(), unchanged,
                ServiceDiff.changedKeys(oldEnv, configuration));
        run.diff = diff;

        run.transition(ReconciliationState.APPLYING, "Removing services " + removed);
        try {
            lifecycle.removeServices(removed);
        } catch (CompensationException e) {
            log.error("Removal of {} failed and {} could not be put back; manual recovery required from backup {}",
                    removed, e.getUnrecovered(), run.snapshotId, e);
            var errors = new ArrayList<AioError>();
            if (e.getCause() instanceof AioException cause) errors.add(cause.getError());
            errors.add(rollbackFailed(run, e.getMessage()).withDetails(Map.of(
                    "snapshotId", run.snapshotId, "services", e.getUnrecovered())));
            if (metrics != null) metrics.recordRollback(false);
            return run.finish(ReconciliationState.MANUAL_RECOVERY_REQUIRED, errors);
        } catch (AioException e) {
            // removeServices has already put containers and files back
            log.error("Removal of {} failed: {}", removed, e.getMessage(), e);
            return run.finish(ReconciliationState.ROLLED_BACK, List.of(e.getError()));
        }
        removed.forEach(name -> publish(run, AioEvent.SERVICE_REMOVED, name, Map.of()));

        try {
            AtomicFiles.write(properties.getEnvPath(), EnvFile.render(configuration));
            InstallationState afterRemoval = stateRepository.loadOrEmpty();
            stateRepository.save(afterRemoval.commit(run.resolvedProfiles, configuration, afterRemoval.services(),
                    historyEntry("remove-profile", run, diff)));
        } catch (IOException e) {
            return rollback(run, oldCompose, diff,
                    new StorageException("env_write_failed", "Cannot write " + properties.getEnvPath(), e));
        } catch (AioException e) {
            return rollback(run, oldCompose, diff, e);
        }
        return commit(run);
    }

    // -- apply and rollback -----------------------------------------------------------

    private void applyContainers(Run run, ComposeDocument target, ServiceDiff diff) {
        Instant deadline = clock.instant().plus(properties.getApplyTimeout());
        for (var phase : byPhase(diff.removed(), true).entrySet()) {
            runPhase(run, phase.getKey(), phase.getValue(), name -> {
                lifecycle.undeploy(name);
                publish(run, AioEvent.SERVICE_REMOVED, name, Map.of("phase", phase.getKey().name()));
            }, deadline);
        }
        var deploy = new ArrayList<>(diff.added());
        deploy.addAll(diff.changed());
        for (var phase : byPhase(deploy, false).entrySet()) {
            runPhase(run, phase.getKey(), phase.getValue(), name -> {
                lifecycle.deploy(target.services().get(name), properties.getImageTimeout());
                publish(run, AioEvent.SERVICE_DEPLOYED, name, Map.of("phase", phase.getKey().name()));
            }, deadline);
        }
    }

    private Map<StartupPhase, List<String>> byPhase(List<String> services, boolean reverse) {
        Comparator<StartupPhase> order = Comparator.comparingInt(StartupPhase::order);
        var phases = new TreeMap<StartupPhase, List<String>>(reverse ? order.reversed() : order);
        for (String name : services) {
            StartupPhase phase = catalog.findService(name).map(ServiceRef::phase).orElse(StartupPhase.APPLICATIONS);
            phases.computeIfAbsent(phase, p -> new ArrayList<>()).add(name);
        }
        return phases;
    }

    private void runPhase(Run run, StartupPhase phase, List<String> services, Consumer<String> operation,
                          Instant deadline) {
        run.checkCancelled();
        log.info("Phase {}: {}", phase, services);
        var futures = new ArrayList<Future<?>>();
        for (String name : services) {
            futures.add(executor.submit(() -> {
                MdcContext.setService(run.id, name);
                try {
                    operation.accept(name);
                } finally {
                    MdcContext.clear();
                }
            }));
        }
        run.inFlight = futures;
        try {
            for (Future<?> future : futures) {
                long remaining = Duration.between(clock.instant(), deadline).toMillis();
                if (remaining <= 0) {
                    throw new TimeoutException();
                }
                future.get(remaining, TimeUnit.MILLISECONDS);
            }
        } catch (TimeoutException e) {
            cancelAll(futures);
            throw new EngineException(null, "Apply did not finish within " + properties.getApplyTimeout());
        } catch (CancellationException e) {
            cancelAll(futures);
            throw new EngineException(null, "Reconfiguration cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new EngineException(null, "Reconfiguration interrupted", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            if (e.getCause() instanceof AioException aio) {
                throw aio;
            }
            throw new EngineException(null, "Unexpected failure in phase " + phase + ": " + e.getCause(), e.getCause());
        } finally {
            run.inFlight = List.of();
        }
        run.checkCancelled();
    }

    private static void cancelAll(List<Future<?>> futures) {
        futures.forEach(f -> f.cancel(true));
    }

    /**
     * Puts the snapshot files back and converges containers to the old document:
     * services the failed run added are removed, services it removed or changed are
     * redeployed from their old definition.
     */
    private ReconciliationOutcome rollback(Run run, ComposeDocument oldCompose, ServiceDiff diff, AioException cause) {
        log.error("Apply failed: {}; rolling back to backup {}", cause.getMessage(), run.snapshotId, cause);
        var errors = new ArrayList<AioError>();
        errors.add(cause.getError());
        try {
            versionStore.restoreBackup(run.snapshotId, false);
            for (var phase : byPhase(diff.added(), true).values()) {
                phase.forEach(lifecycle::undeploy);
            }
            var redeploy = new ArrayList<>(diff.removed());
            redeploy.addAll(diff.changed());
            for (var phase : byPhase(redeploy, false).values()) {
                for (String name : phase) {
                    if (oldCompose.services().containsKey(name)) {
                        lifecycle.deploy(oldCompose.services().get(name), properties.getImageTimeout());
                    }
                }
            }
            if (metrics != null) metrics.recordRollback(true);
            return run.finish(ReconciliationState.ROLLED_BACK, errors);
        } catch (AioException e) {
            log.error("Rollback of {} failed; manual recovery required from backup {}", run.id, run.snapshotId, e);
            errors.add(rollbackFailed(run, e.getMessage()));
            if (metrics != null) metrics.recordRollback(false);
            return run.finish(ReconciliationState.MANUAL_RECOVERY_REQUIRED, errors);
        }
    }

    private static AioError rollbackFailed(Run run, String reason) {
        return new AioError(ErrorKind.ENGINE, "rollback_failed", "Rollback failed: " + reason,
                "Restore backup " + run.snapshotId + " with 'kaspa-aio backup restore " + run.snapshotId + "'",
                Map.of("snapshotId", run.snapshotId));
    }

    private ReconciliationOutcome commit(Run run) {
        ReconciliationOutcome outcome = run.finish(ReconciliationState.COMMITTED, List.of());
        try {
            versionStore.cleanupOldBackups();
        } catch (StorageException e) {
            log.warn("Pruning old backups failed: {}", e.getMessage(), e);
        }
        return outcome;
    }

    // -- plumbing ---------------------------------------------------------------------

    private ConfigurationSnapshot snapshot(Run run, String reason) {
        var metadata = new LinkedHashMap<String, String>();
        metadata.put("reconciliationId", run.id);
        metadata.put("profiles", String.join(",", run.resolvedProfiles));
        ConfigurationSnapshot snapshot = versionStore.createBackup(reason, metadata);
        if (metrics != null) metrics.recordBackup("snapshot");
        return snapshot;
    }

    private HistoryEntry historyEntry(String action, Run run, ServiceDiff diff) {
        return new HistoryEntry(action, clock.instant(), run.id, run.snapshotId, run.resolvedProfiles,
                diff.added(), diff.removed(), diff.changed(), diff.changedKeys());
    }

    @FunctionalInterface
    private interface Body {
        ReconciliationOutcome run();
    }

    private ReconciliationOutcome execute(Run run, Map<String, Object> payload, Body body) {
        MdcContext.setReconciliation(run.id);
        long startMs = System.currentTimeMillis();
        try {
            log.info("Starting reconciliation {} ({})", run.id, run.reason);
            publish(run, AioEvent.STARTED, null, payload);
            ReconciliationOutcome outcome = body.run();
            lastOutcome = outcome;
            if (metrics != null) {
                metrics.recordReconciliation(outcome.status().name().toLowerCase(), System.currentTimeMillis() - startMs);
                metrics.recordChangeSize(outcome.diff().touched());
            }
            publish(run, terminalEvent(outcome.status()), null, Map.of(
                    "status", outcome.status().name(),
                    "errors", outcome.errors().stream().map(AioError::code).toList()));
            return outcome;
        } finally {
            MdcContext.clear();
        }
    }

    private ReconciliationOutcome locked(Run run, Body body) {
        if (!lock.tryLock()) {
            log.warn("Reconciliation {} turned away: another run holds the lock", run.id);
            return run.finish(ReconciliationState.FAILED,
                    List.of(AioError.concurrency("Reconfiguration in progress")));
        }
        current = run;
        try {
            return body.run();
        } finally {
            current = null;
            lock.unlock();
        }
    }

    private static String terminalEvent(ReconciliationState state) {
        return switch (state) {
            case COMMITTED -> AioEvent.COMMITTED;
            case ROLLED_BACK -> AioEvent.ROLLED_BACK;
            default -> AioEvent.FAILED;
        };
    }

    private void publish(Run run, String type, String service, Map<String, Object> payload) {
        eventBus.publish(new AioEvent(type, run.id, service, payload, clock.instant()));
    }

    private String nextId() {
        return String.format("RCN-%s-%04d", ID_FORMAT.format(clock.instant()), RUN_COUNTER.incrementAndGet());
    }

    /**
     * Requests cancellation of the running reconciliation. In-flight service operations
     * are interrupted and the run rolls back.
     *
     * @return true if a run was active
     */
    public boolean cancel() {
        Run run = current;
        if (run == null || run.state.isTerminal()) {
            return false;
        }
        log.warn("Cancellation requested for {}", run.id);
        run.cancelRequested = true;
        cancelAll(run.inFlight);
        return true;
    }

    public ReconciliationState currentState() {
        Run run = current;
        return run != null ? run.state : ReconciliationState.IDLE;
    }

    /** Partial progress of the running reconciliation, if any. */
    public Optional<ReconciliationOutcome> currentProgress() {
        Run run = current;
        return run != null ? Optional.of(run.outcome(List.of())) : Optional.empty();
    }

    public Optional<ReconciliationOutcome> lastOutcome() {
        return Optional.ofNullable(lastOutcome);
    }

    private final class Run {
        final String id;
        final String reason;
        final List<ReconciliationOutcome.Step> progress = new CopyOnWriteArrayList<>();
        final List<String> warnings = new CopyOnWriteArrayList<>();
        volatile ReconciliationState state = ReconciliationState.IDLE;
        volatile List<String> resolvedProfiles = List.of();
        volatile String snapshotId;
        volatile ServiceDiff diff = ServiceDiff.empty();
        volatile boolean cancelRequested;
        volatile List<Future<?>> inFlight = List.of();

        Run(String id, String reason) {
            this.id = id;
            this.reason = reason;
        }

        void transition(ReconciliationState next, String message) {
            state = next;
            progress.add(new ReconciliationOutcome.Step(next, message, clock.instant()));
            MdcContext.setPhase(id, next.name());
            log.info("{}: {}", next, message);
            publish(this, AioEvent.PHASE, null, Map.of("state", next.name(), "message", message));
        }

        void checkCancelled() {
            if (cancelRequested) {
                throw new EngineException(null, "Reconfiguration cancelled");
            }
        }

        ReconciliationOutcome finish(ReconciliationState terminal, List<AioError> errors) {
            String message = errors.isEmpty() ? terminal.name().toLowerCase()
                    : errors.get(0).message() + (errors.size() > 1 ? " (+" + (errors.size() - 1) + " more)" : "");
            transition(terminal, message);
            return outcome(errors);
        }

        ReconciliationOutcome outcome(List<AioError> errors) {
            return new ReconciliationOutcome(id, state, resolvedProfiles, snapshotId, diff, errors,
                    List.copyOf(warnings), List.copyOf(progress));
        }
    }
}
