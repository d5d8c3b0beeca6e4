package com.kaspaaio.dispatch.cli;

import com.kaspaaio.core.store.HistoryEntry;
import com.kaspaaio.core.store.InstallationStateRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: kaspa-aio history
 * <p>
 * Lists committed changes as a table: Run ID | Action | Backup | Profiles.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List committed changes")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final InstallationStateRepository stateRepository;

    public HistoryCommand(InstallationStateRepository stateRepository) {
        this.stateRepository = stateRepository;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<HistoryEntry> history = stateRepository.loadOrEmpty().history();
        if (history.isEmpty()) {
            ConsoleOutput.info("No changes recorded.");
            return;
        }

        List<HistoryEntry> display = history.size() > limit
                ? history.subList(history.size() - limit, history.size())
                : history;

        ConsoleOutput.info("Changes (" + display.size() + " of " + history.size() + "):");
        System.out.println();
        System.out.printf("  %-24s %-16s %-26s %s%n", "RUN ID", "ACTION", "BACKUP", "PROFILES");
        System.out.println("  " + "-".repeat(90));

        for (HistoryEntry entry : display) {
            System.out.printf("  %-24s %-16s %-26s %s%n",
                    entry.reconciliationId(), entry.action(),
                    entry.snapshotId() != null ? entry.snapshotId() : "-",
                    ConsoleOutput.truncate(String.join(",", entry.profiles()), 30));
        }
    }
}
