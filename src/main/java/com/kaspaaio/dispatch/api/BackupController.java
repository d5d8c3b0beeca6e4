package com.kaspaaio.dispatch.api;

import com.kaspaaio.core.engine.ReconciliationEngine;
import com.kaspaaio.core.engine.ReconciliationOutcome;
import com.kaspaaio.core.metrics.AioMetrics;
import com.kaspaaio.core.store.ConfigurationSnapshot;
import com.kaspaaio.core.store.SnapshotDiff;
import com.kaspaaio.core.store.StorageUsage;
import com.kaspaaio.core.store.VersionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for configuration backups.
 */
@RestController
@RequestMapping("/api/v1/backups")
public class BackupController {

    private static final Logger log = LoggerFactory.getLogger(BackupController.class);

    private final VersionStore versionStore;
    private final ReconciliationEngine engine;
    private final AioMetrics metrics;

    public BackupController(VersionStore versionStore, ReconciliationEngine engine,
                            @Autowired(required = false) AioMetrics metrics) {
        this.versionStore = versionStore;
        this.engine = engine;
        this.metrics = metrics;
    }

    @GetMapping
    public List<ConfigurationSnapshot> list(@RequestParam(defaultValue = "0") int limit) {
        return limit > 0 ? versionStore.listBackups(limit) : versionStore.listBackups();
    }

    @PostMapping
    public ResponseEntity<ConfigurationSnapshot> create(@RequestBody(required = false) BackupRequest request) {
        String reason = request != null && request.reason() != null ? request.reason() : "manual";
        ConfigurationSnapshot backup = versionStore.createBackup(reason, Map.of("source", "api"));
        log.info("Created backup {} via API", backup.id());
        countBackup("create");
        return ResponseEntity.status(HttpStatus.CREATED).body(backup);
    }

    @GetMapping("/usage")
    public StorageUsage usage() {
        return versionStore.getStorageUsage();
    }

    @GetMapping("/{id}")
    public ResponseEntity<ConfigurationSnapshot> get(@PathVariable String id) {
        return versionStore.getBackup(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        if (!versionStore.deleteBackup(id)) {
            return ResponseEntity.notFound().build();
        }
        countBackup("delete");
        return ResponseEntity.noContent().build();
    }

    /** GET /api/v1/backups/{id}/diff?to=current. Secret values are masked. */
    @GetMapping("/{id}/diff")
    public ResponseEntity<SnapshotDiff> diff(@PathVariable String id,
                                             @RequestParam(defaultValue = VersionStore.CURRENT) String to) {
        if (versionStore.getBackup(id).isEmpty()
                || (!VersionStore.CURRENT.equals(to) && versionStore.getBackup(to).isEmpty())) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(versionStore.diff(id, to));
    }

    /**
     * POST /api/v1/backups/{id}/restore. Restores the files and re-applies the
     * services they describe, under the same lock as a reconfiguration.
     */
    @PostMapping("/{id}/restore")
    public ResponseEntity<ReconciliationOutcome> restore(@PathVariable String id) {
        ReconciliationOutcome outcome = engine.restore(id);
        countBackup("restore");
        return ResponseEntity.status(ReconfigurationController.statusFor(outcome)).body(outcome);
    }

    @PostMapping("/cleanup")
    public Map<String, Object> cleanup(@RequestParam(required = false) Integer keep) {
        List<String> deleted = keep != null ? versionStore.cleanupOldBackups(keep) : versionStore.cleanupOldBackups();
        deleted.forEach(d -> countBackup("delete"));
        return Map.of("deleted", deleted);
    }

    private void countBackup(String operation) {
        if (metrics != null) {
            metrics.recordBackup(operation);
        }
    }

    public record BackupRequest(String reason) {}
}
