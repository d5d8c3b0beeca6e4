package com.kaspaaio.dispatch.cli;

import com.kaspaaio.core.engine.ReconciliationEngine;
import com.kaspaaio.core.error.EngineException;
import com.kaspaaio.core.store.InstallationState;
import com.kaspaaio.core.store.InstallationStateRepository;
import com.kaspaaio.lifecycle.ContainerStatus;
import com.kaspaaio.lifecycle.ServiceLifecycleManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Map;

/**
 * CLI command: kaspa-aio status
 * <p>
 * Shows the installed selection and the runtime state of each service container.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show installation and service status")
@Component
public class StatusCommand implements Runnable {

    private final InstallationStateRepository stateRepository;
    private final ServiceLifecycleManager lifecycle;
    private final ReconciliationEngine engine;

    public StatusCommand(InstallationStateRepository stateRepository, ServiceLifecycleManager lifecycle,
                         ReconciliationEngine engine) {
        this.stateRepository = stateRepository;
        this.lifecycle = lifecycle;
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        InstallationState state = stateRepository.loadOrEmpty();
        if (!state.isInstalled()) {
            ConsoleOutput.info("Nothing installed yet. Run 'kaspa-aio reconfigure <profile>...'.");
            return;
        }

        ConsoleOutput.info("Profiles: " + String.join(", ", state.selectedProfiles()));
        ConsoleOutput.info("Last modified: " + state.lastModified());
        ConsoleOutput.info("Engine: " + engine.currentState().name().toLowerCase());
        System.out.println();

        Map<String, ContainerStatus> statuses;
        try {
            statuses = lifecycle.statusAll(state.services());
        } catch (EngineException e) {
            ConsoleOutput.error("Cannot query containers: " + e.getMessage());
            return;
        }

        System.out.printf("  %-28s %-12s %-10s %s%n", "SERVICE", "STATE", "HEALTH", "IMAGE");
        System.out.println("  " + "-".repeat(76));
        statuses.forEach((name, status) -> System.out.printf("  %-28s %-12s %-10s %s%n",
                name, status.state().name().toLowerCase(),
                status.health() != null ? status.health() : "-",
                ConsoleOutput.truncate(status.image(), 30)));
    }
}
