package com.kaspaaio.dispatch.cli;

import com.kaspaaio.core.engine.ReconciliationEngine;
import com.kaspaaio.core.engine.ReconciliationOutcome;
import com.kaspaaio.core.error.StorageException;
import com.kaspaaio.core.store.ConfigurationSnapshot;
import com.kaspaaio.core.store.SnapshotDiff;
import com.kaspaaio.core.store.StorageUsage;
import com.kaspaaio.core.store.VersionStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command group: kaspa-aio backup list|create|restore|diff|delete|cleanup|usage
 */
@Command(name = "backup", mixinStandardHelpOptions = true, description = "Manage configuration backups",
        subcommands = {
                BackupCommand.ListBackups.class,
                BackupCommand.CreateBackup.class,
                BackupCommand.RestoreBackup.class,
                BackupCommand.DiffBackups.class,
                BackupCommand.DeleteBackup.class,
                BackupCommand.CleanupBackups.class,
                BackupCommand.Usage.class
        })
@Component
public class BackupCommand implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "list", mixinStandardHelpOptions = true, description = "List backups, newest first")
    @Component
    static class ListBackups implements Runnable {

        @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "20")
        private int limit;

        private final VersionStore store;

        ListBackups(VersionStore store) {
            this.store = store;
        }

        @Override
        public void run() {
            ConsoleOutput.printBanner();
            List<ConfigurationSnapshot> backups = store.listBackups(limit);
            if (backups.isEmpty()) {
                ConsoleOutput.info("No backups found.");
                return;
            }
            System.out.printf("  %-24s %-22s %-10s %-20s %s%n", "BACKUP ID", "CREATED", "SIZE", "REASON", "PROFILES");
            System.out.println("  " + "-".repeat(96));
            for (ConfigurationSnapshot b : backups) {
                System.out.printf("  %-24s %-22s %-10s %-20s %s%n",
                        b.id(), b.createdAt().toString().substring(0, 19),
                        ConsoleOutput.formatBytes(b.totalSize()),
                        ConsoleOutput.truncate(b.reason(), 20),
                        ConsoleOutput.truncate(String.join(",", b.selectedProfiles()), 30));
            }
        }
    }

    @Command(name = "create", mixinStandardHelpOptions = true, description = "Back up the current configuration")
    @Component
    static class CreateBackup implements Callable<Integer> {

        @Option(names = "--reason", description = "Why the backup was taken", defaultValue = "manual")
        private String reason;

        private final VersionStore store;

        CreateBackup(VersionStore store) {
            this.store = store;
        }

        @Override
        public Integer call() {
            ConsoleOutput.printBanner();
            try {
                ConfigurationSnapshot backup = store.createBackup(reason, Map.of("source", "cli"));
                ConsoleOutput.success("Created backup " + backup.id() + " ("
                        + ConsoleOutput.formatBytes(backup.totalSize()) + ")");
                return 0;
            } catch (StorageException e) {
                ConsoleOutput.error(e.getError());
                return 1;
            }
        }
    }

    @Command(name = "restore", mixinStandardHelpOptions = true,
            description = "Restore a backup and re-apply the services it describes")
    @Component
    static class RestoreBackup implements Callable<Integer> {

        @Parameters(index = "0", description = "Backup ID")
        private String backupId;

        private final ReconciliationEngine engine;

        RestoreBackup(ReconciliationEngine engine) {
            this.engine = engine;
        }

        @Override
        public Integer call() {
            ConsoleOutput.printBanner();
            ConsoleOutput.info("Restoring " + backupId);
            ReconciliationOutcome outcome = engine.restore(backupId);
            ConsoleOutput.outcome(outcome);
            return outcome.isCommitted() ? 0 : 1;
        }
    }

    @Command(name = "diff", mixinStandardHelpOptions = true,
            description = "Compare two backups (default target: the live configuration)")
    @Component
    static class DiffBackups implements Callable<Integer> {

        @Parameters(index = "0", description = "Backup ID to compare from")
        private String from;

        @Parameters(index = "1", arity = "0..1", defaultValue = VersionStore.CURRENT,
                description = "Backup ID to compare to, or 'current'")
        private String to;

        private final VersionStore store;

        DiffBackups(VersionStore store) {
            this.store = store;
        }

        @Override
        public Integer call() {
            ConsoleOutput.printBanner();
            SnapshotDiff diff;
            try {
                diff = store.diff(from, to);
            } catch (StorageException e) {
                ConsoleOutput.error(e.getError());
                return 1;
            }
            if (diff.changes().isEmpty()) {
                ConsoleOutput.info("No differences between " + from + " and " + to);
                return 0;
            }
            ConsoleOutput.info(diff.changeCount() + " changes from " + from + " to " + to + ":");
            for (SnapshotDiff.Change change : diff.changes()) {
                String line = switch (change.type()) {
                    case ADDED -> "  @|fg(green) +|@ " + change.key() + " = " + change.newValue();
                    case REMOVED -> "  @|fg(red) -|@ " + change.key() + " (was " + change.oldValue() + ")";
                    case CHANGED -> "  @|fg(yellow) ~|@ " + change.key() + ": "
                            + change.oldValue() + " -> " + change.newValue();
                };
                System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
            }
            return 0;
        }
    }

    @Command(name = "delete", mixinStandardHelpOptions = true, description = "Delete a backup")
    @Component
    static class DeleteBackup implements Callable<Integer> {

        @Parameters(index = "0", description = "Backup ID")
        private String backupId;

        private final VersionStore store;

        DeleteBackup(VersionStore store) {
            this.store = store;
        }

        @Override
        public Integer call() {
            ConsoleOutput.printBanner();
            if (store.deleteBackup(backupId)) {
                ConsoleOutput.success("Deleted " + backupId);
                return 0;
            }
            ConsoleOutput.error("No backup named " + backupId);
            return 1;
        }
    }

    @Command(name = "cleanup", mixinStandardHelpOptions = true, description = "Delete all but the newest backups")
    @Component
    static class CleanupBackups implements Runnable {

        @Option(names = "--keep", description = "Backups to keep (default: configured retention)")
        private Integer keep;

        private final VersionStore store;

        CleanupBackups(VersionStore store) {
            this.store = store;
        }

        @Override
        public void run() {
            ConsoleOutput.printBanner();
            List<String> deleted = keep != null ? store.cleanupOldBackups(keep) : store.cleanupOldBackups();
            if (deleted.isEmpty()) {
                ConsoleOutput.info("Nothing to clean up.");
            } else {
                ConsoleOutput.success("Deleted " + deleted.size() + " backups: " + String.join(", ", deleted));
            }
        }
    }

    @Command(name = "usage", mixinStandardHelpOptions = true, description = "Show backup storage usage")
    @Component
    static class Usage implements Runnable {

        private final VersionStore store;

        Usage(VersionStore store) {
            this.store = store;
        }

        @Override
        public void run() {
            ConsoleOutput.printBanner();
            StorageUsage usage = store.getStorageUsage();
            ConsoleOutput.info(usage.backupCount() + " backups, " + usage.fileCount() + " files, "
                    + ConsoleOutput.formatBytes(usage.totalBytes()));
        }
    }
}
