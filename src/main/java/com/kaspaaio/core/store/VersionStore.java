package com.kaspaaio.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kaspaaio.core.config.ComposeCodec;
import com.kaspaaio.core.config.ComposeDocument;
import com.kaspaaio.core.config.ComposeService;
import com.kaspaaio.core.error.StorageException;
import com.kaspaaio.lifecycle.AioProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Versioned store of configuration backups under {@code <install-root>/.kaspa-backups/<id>/}.
 *
 * <p>A backup captures the compose document, the environment file and the installation
 * state as one unit: files are copied into a staging directory which is renamed into
 * place only when complete. Backups are immutable once created.
 */
@Service
public class VersionStore {

    private static final Logger log = LoggerFactory.getLogger(VersionStore.class);

    public static final String COMPOSE_FILE = "docker-compose.yml";
    public static final String ENV_FILE = ".env";
    public static final String STATE_FILE = "installation-state.json";
    public static final String METADATA_FILE = "backup-metadata.json";

    /** Pseudo-ID naming the live files in {@link #diff(String, String)}. */
    public static final String CURRENT = "current";

    private static final String STAGING_PREFIX = ".staging-";
    private static final Pattern BACKUP_ID = Pattern.compile("^[0-9A-Za-z][0-9A-Za-z_-]*$");
    private static final Pattern SECRET_KEY = Pattern.compile(".*(PASSWORD|SECRET|TOKEN).*");
    private static final DateTimeFormatter ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneOffset.UTC);

    private final Path installRoot;
    private final Path backupRoot;
    private final Map<String, Path> liveFiles;
    private final int retention;
    private final ComposeCodec composeCodec;
    private final InstallationStateRepository stateRepository;
    private final Clock clock;
    private final ObjectMapper mapper = InstallationStateRepository.stateMapper();

    @Autowired
    public VersionStore(AioProperties properties, ComposeCodec composeCodec,
                        InstallationStateRepository stateRepository) {
        this(properties, composeCodec, stateRepository, Clock.systemUTC());
    }

    public VersionStore(AioProperties properties, ComposeCodec composeCodec,
                        InstallationStateRepository stateRepository, Clock clock) {
        this.installRoot = properties.getInstallRoot();
        this.backupRoot = properties.getBackupRoot();
        this.retention = properties.getBackupRetention();
        this.composeCodec = composeCodec;
        this.stateRepository = stateRepository;
        this.clock = clock;
        var files = new LinkedHashMap<String, Path>();
        files.put(COMPOSE_FILE, properties.getComposePath());
        files.put(ENV_FILE, properties.getEnvPath());
        files.put(STATE_FILE, properties.getStatePath());
        this.liveFiles = files;
    }

    /**
     * Captures the current compose document, environment file and installation state.
     * Files that do not exist are recorded as absent and deleted again on restore.
     *
     * @throws StorageException if the backup cannot be written; nothing is left behind
     */
    public ConfigurationSnapshot createBackup(String reason, Map<String, String> metadata) {
        String id = nextId();
        Path staging = backupRoot.resolve(STAGING_PREFIX + id);
        try {
            Files.createDirectories(staging);
            var files = new ArrayList<SnapshotFile>();
            long totalSize = 0;
            for (var entry : liveFiles.entrySet()) {
                Path source = entry.getValue();
                if (!Files.isRegularFile(source)) continue;
                byte[] content = Files.readAllBytes(source);
                Files.write(staging.resolve(entry.getKey()), content);
                files.add(new SnapshotFile(entry.getKey(), content.length, installRoot.relativize(source).toString()));
                totalSize += content.length;
            }
            var snapshot = new ConfigurationSnapshot(id, clock.instant(), reason, metadata,
                    currentProfiles(), files, totalSize);
            Files.writeString(staging.resolve(METADATA_FILE), mapper.writeValueAsString(snapshot));
            AtomicFiles.moveAtomically(staging, backupRoot.resolve(id));
            log.info("Created backup {} ({} files, {} bytes, reason: {})", id, files.size(), totalSize, reason);
            return snapshot;
        } catch (IOException | RuntimeException e) {
            discardStaging(staging, e);
            throw new StorageException("backup_failed", "Failed to create backup: " + e.getMessage(), e);
        }
    }

    private void discardStaging(Path staging, Exception cause) {
        try {
            AtomicFiles.deleteRecursively(staging);
        } catch (IOException cleanup) {
            cause.addSuppressed(cleanup);
            log.warn("Could not remove staging directory {}", staging, cleanup);
        }
    }

    private List<String> currentProfiles() {
        return stateRepository.load().map(InstallationState::selectedProfiles).orElse(List.of());
    }

    private synchronized String nextId() {
        String base = ID_FORMAT.format(clock.instant());
        String id = base;
        int suffix = 1;
        while (Files.exists(backupRoot.resolve(id)) || Files.exists(backupRoot.resolve(STAGING_PREFIX + id))) {
            id = base + "-" + suffix++;
        }
        return id;
    }

    /** All backups, newest first. Unreadable backup directories are skipped. */
    public List<ConfigurationSnapshot> listBackups() {
        if (!Files.isDirectory(backupRoot)) {
            return List.of();
        }
        var snapshots = new ArrayList<ConfigurationSnapshot>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(backupRoot, Files::isDirectory)) {
            for (Path dir : dirs) {
                if (dir.getFileName().toString().startsWith(STAGING_PREFIX)) continue;
                readMetadata(dir).ifPresent(snapshots::add);
            }
        } catch (IOException e) {
            throw new StorageException("backup_list_failed", "Cannot list backups in " + backupRoot, e);
        }
        snapshots.sort(Comparator.comparing(ConfigurationSnapshot::createdAt)
                .thenComparing(ConfigurationSnapshot::id)
                .reversed());
        return snapshots;
    }

    public List<ConfigurationSnapshot> listBackups(int limit) {
        List<ConfigurationSnapshot> all = listBackups();
        return limit > 0 && all.size() > limit ? all.subList(0, limit) : all;
    }

    public Optional<ConfigurationSnapshot> getBackup(String id) {
        if (id == null || !BACKUP_ID.matcher(id).matches()) {
            return Optional.empty();
        }
        Path dir = backupRoot.resolve(id);
        return Files.isDirectory(dir) ? readMetadata(dir) : Optional.empty();
    }

    private Optional<ConfigurationSnapshot> readMetadata(Path dir) {
        Path metadata = dir.resolve(METADATA_FILE);
        try {
            if (!Files.isRegularFile(metadata)) {
                log.warn("Backup directory {} has no metadata, skipping", dir);
                return Optional.empty();
            }
            return Optional.of(mapper.readValue(Files.readString(metadata), ConfigurationSnapshot.class));
        } catch (IOException e) {
            log.warn("Unreadable backup metadata in {}: {}", dir, e.getMessage());
            return Optional.empty();
        }
    }

    public SnapshotContents readContents(String id) {
        if (CURRENT.equals(id)) {
            try {
                return new SnapshotContents(
                        AtomicFiles.readIfExists(liveFiles.get(COMPOSE_FILE)).orElse(null),
                        AtomicFiles.readIfExists(liveFiles.get(ENV_FILE)).orElse(null),
                        AtomicFiles.readIfExists(liveFiles.get(STATE_FILE)).orElse(null));
            } catch (IOException e) {
                throw new StorageException("read_failed", "Cannot read current configuration", e);
            }
        }
        ConfigurationSnapshot snapshot = require(id);
        Path dir = backupRoot.resolve(snapshot.id());
        try {
            return new SnapshotContents(
                    snapshot.captured(COMPOSE_FILE) ? Files.readString(dir.resolve(COMPOSE_FILE)) : null,
                    snapshot.captured(ENV_FILE) ? Files.readString(dir.resolve(ENV_FILE)) : null,
                    snapshot.captured(STATE_FILE) ? Files.readString(dir.resolve(STATE_FILE)) : null);
        } catch (IOException e) {
            throw new StorageException("backup_read_failed", "Cannot read backup " + id, e);
        }
    }

    private ConfigurationSnapshot require(String id) {
        return getBackup(id).orElseThrow(() ->
                new StorageException("backup_not_found", "Backup not found: " + id));
    }

    /**
     * Writes the files of a backup back into the installation. Files absent from the
     * backup are deleted so the installation matches the captured state exactly.
     *
     * @param createBackupBeforeRestore take a backup of the current state first, so the
     *                                  restore itself can be undone
     * @throws StorageException if the backup is missing or a file cannot be written; the
     *                          pre-restore backup, if taken, is named in the message
     */
    public RestoreResult restoreBackup(String id, boolean createBackupBeforeRestore) {
        ConfigurationSnapshot snapshot = require(id);
        Path dir = backupRoot.resolve(snapshot.id());

        var contents = new LinkedHashMap<String, byte[]>();
        try {
            for (String file : liveFiles.keySet()) {
                if (snapshot.captured(file)) {
                    contents.put(file, Files.readAllBytes(dir.resolve(file)));
                }
            }
        } catch (IOException e) {
            throw new StorageException("backup_read_failed", "Cannot read backup " + id, e);
        }

        String preRestoreId = null;
        if (createBackupBeforeRestore) {
            preRestoreId = createBackup("pre-restore", Map.of("restoring", id)).id();
        }

        var restored = new ArrayList<String>();
        var removed = new ArrayList<String>();
        try {
            for (var entry : liveFiles.entrySet()) {
                byte[] content = contents.get(entry.getKey());
                if (content != null) {
                    AtomicFiles.write(entry.getValue(), content);
                    restored.add(entry.getKey());
                } else if (Files.deleteIfExists(entry.getValue())) {
                    removed.add(entry.getKey());
                }
            }
        } catch (IOException e) {
            String hint = preRestoreId != null ? "; pre-restore backup " + preRestoreId + " is available" : "";
            throw new StorageException("restore_failed", "Failed to restore backup " + id + hint, e);
        }
        log.info("Restored backup {} (restored {}, removed {}, pre-restore backup {})",
                id, restored, removed, preRestoreId);
        return new RestoreResult(id, restored, removed, preRestoreId, true);
    }

    /**
     * Compares the environment maps and compose service blocks of two snapshots.
     * Either ID may be {@link #CURRENT}. Secret values are masked.
     */
    public SnapshotDiff diff(String fromId, String toId) {
        SnapshotContents from = readContents(fromId);
        SnapshotContents to = readContents(toId);
        var changes = new ArrayList<SnapshotDiff.Change>();

        Map<String, String> envFrom = parseEnv(fromId, from);
        Map<String, String> envTo = parseEnv(toId, to);
        for (String key : union(envFrom.keySet(), envTo.keySet())) {
            String a = envFrom.get(key);
            String b = envTo.get(key);
            if (Objects.equals(a, b)) continue;
            changes.add(new SnapshotDiff.Change(key, typeOf(a, b), mask(key, a), mask(key, b)));
        }

        ComposeDocument composeFrom = parseCompose(fromId, from);
        ComposeDocument composeTo = parseCompose(toId, to);
        for (String name : union(composeFrom.services().keySet(), composeTo.services().keySet())) {
            ComposeService a = composeFrom.services().get(name);
            ComposeService b = composeTo.services().get(name);
            if (Objects.equals(a, b)) continue;
            changes.add(new SnapshotDiff.Change("service:" + name, typeOf(a, b), null, null));
        }
        return new SnapshotDiff(fromId, toId, changes);
    }

    private static TreeSet<String> union(Set<String> a, Set<String> b) {
        var all = new TreeSet<>(a);
        all.addAll(b);
        return all;
    }

    private static SnapshotDiff.ChangeType typeOf(Object before, Object after) {
        if (before == null) return SnapshotDiff.ChangeType.ADDED;
        if (after == null) return SnapshotDiff.ChangeType.REMOVED;
        return SnapshotDiff.ChangeType.CHANGED;
    }

    /** Hides the value of password, secret and token keys. */
    public static String mask(String key, String value) {
        if (value == null) return null;
        return SECRET_KEY.matcher(key).matches() ? "********" : value;
    }

    private static Map<String, String> parseEnv(String id, SnapshotContents contents) {
        try {
            return contents.env();
        } catch (IllegalArgumentException e) {
            throw new StorageException("corrupt_env", "Environment file of " + id + " is malformed: " + e.getMessage(), e);
        }
    }

    private ComposeDocument parseCompose(String id, SnapshotContents contents) {
        try {
            return composeCodec.read(contents.composeYaml());
        } catch (IllegalArgumentException e) {
            throw new StorageException("corrupt_compose", "Compose document of " + id + " is malformed", e);
        }
    }

    public boolean deleteBackup(String id) {
        if (getBackup(id).isEmpty()) {
            return false;
        }
        try {
            AtomicFiles.deleteRecursively(backupRoot.resolve(id));
            log.info("Deleted backup {}", id);
            return true;
        } catch (IOException e) {
            throw new StorageException("backup_delete_failed", "Cannot delete backup " + id, e);
        }
    }

    /** Keeps the newest backups up to the configured retention, deleting oldest first. */
    public List<String> cleanupOldBackups() {
        return cleanupOldBackups(retention);
    }

    public List<String> cleanupOldBackups(int keep) {
        List<ConfigurationSnapshot> all = listBackups();
        if (all.size() <= keep) {
            return List.of();
        }
        var deleted = new ArrayList<String>();
        List<ConfigurationSnapshot> expired = new ArrayList<>(all.subList(Math.max(keep, 0), all.size()));
        expired.sort(Comparator.comparing(ConfigurationSnapshot::createdAt).thenComparing(ConfigurationSnapshot::id));
        for (ConfigurationSnapshot snapshot : expired) {
            if (deleteBackup(snapshot.id())) {
                deleted.add(snapshot.id());
            }
        }
        log.info("Pruned {} backups, keeping {}", deleted.size(), keep);
        return deleted;
    }

    public StorageUsage getStorageUsage() {
        if (!Files.isDirectory(backupRoot)) {
            return new StorageUsage(0, 0, 0);
        }
        long total = 0;
        long count = 0;
        try (Stream<Path> walk = Files.walk(backupRoot)) {
            for (Path path : walk.filter(Files::isRegularFile).toList()) {
                total += Files.size(path);
                count++;
            }
        } catch (IOException e) {
            throw new StorageException("usage_failed", "Cannot measure " + backupRoot, e);
        }
        return new StorageUsage(total, count, listBackups().size());
    }
}
