package com.kaspaaio.core.health;

import com.kaspaaio.core.store.StorageUsage;
import com.kaspaaio.core.store.VersionStore;
import com.kaspaaio.lifecycle.AioProperties;
import com.kaspaaio.lifecycle.ContainerEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    /** Backup storage above this size is reported as degraded. */
    static final long BACKUP_WARN_BYTES = 512L * 1024 * 1024;

    private final ContainerEngine engine;
    private final AioProperties properties;
    private final VersionStore versionStore;

    public HealthCheckService(
            @Autowired(required = false) ContainerEngine engine,
            AioProperties properties,
            @Autowired(required = false) VersionStore versionStore) {
        this.engine = engine;
        this.properties = properties;
        this.versionStore = versionStore;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDocker());
        results.add(checkInstallDirectory());
        results.add(checkBackups());
        return results;
    }

    private HealthStatus checkDocker() {
        if (engine == null) {
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "No container engine configured", Map.of());
        }
        if (engine.ping()) {
            return new HealthStatus("docker", HealthStatus.Status.UP,
                    "Container engine reachable (" + engine.getClass().getSimpleName() + ")", Map.of());
        }
        return new HealthStatus("docker", HealthStatus.Status.DOWN,
                "Container engine not reachable", Map.of());
    }

    private HealthStatus checkInstallDirectory() {
        Path root = properties.getInstallRoot();
        if (!Files.isDirectory(root)) {
            return new HealthStatus("install-directory", HealthStatus.Status.DOWN,
                    root + " does not exist", Map.of("path", root.toString()));
        }
        try {
            Path probe = Files.createTempFile(root, ".health", ".tmp");
            Files.delete(probe);
            return new HealthStatus("install-directory", HealthStatus.Status.UP,
                    "Writable", Map.of("path", root.toString()));
        } catch (IOException e) {
            log.warn("Install directory health check failed: {}", e.getMessage());
            return new HealthStatus("install-directory", HealthStatus.Status.DOWN,
                    "Not writable: " + e.getMessage(), Map.of("path", root.toString()));
        }
    }

    private HealthStatus checkBackups() {
        if (versionStore == null) {
            return new HealthStatus("backups", HealthStatus.Status.DOWN,
                    "No version store configured", Map.of());
        }
        try {
            StorageUsage usage = versionStore.getStorageUsage();
            var metadata = Map.of(
                    "backups", String.valueOf(usage.backupCount()),
                    "bytes", String.valueOf(usage.totalBytes()));
            if (usage.totalBytes() > BACKUP_WARN_BYTES) {
                return new HealthStatus("backups", HealthStatus.Status.DEGRADED,
                        "Backup storage is large; run backup cleanup", metadata);
            }
            return new HealthStatus("backups", HealthStatus.Status.UP,
                    usage.backupCount() + " backups", metadata);
        } catch (RuntimeException e) {
            log.warn("Backup health check failed: {}", e.getMessage());
            return new HealthStatus("backups", HealthStatus.Status.DOWN,
                    "Backup storage error: " + e.getMessage(), Map.of());
        }
    }
}
