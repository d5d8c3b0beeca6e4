package com.kaspaaio.dispatch.cli;

import com.kaspaaio.core.engine.ReconciliationEngine;
import com.kaspaaio.core.engine.ReconciliationOutcome;
import com.kaspaaio.core.store.InstallationStateRepository;
import com.kaspaaio.core.validation.DependencyValidator;
import com.kaspaaio.core.validation.ValidationResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: kaspa-aio remove &lt;profile&gt;...
 * <p>
 * Removes installed profiles and their services. Profiles still required by
 * another installed profile are refused.
 */
@Command(name = "remove", mixinStandardHelpOptions = true, description = "Remove installed profiles")
@Component
public class RemoveCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Profile IDs to remove")
    private List<String> profiles;

    @Option(names = "--dry-run", description = "Only check whether the removal is allowed")
    private boolean dryRun;

    private final ReconciliationEngine engine;
    private final DependencyValidator validator;
    private final InstallationStateRepository stateRepository;

    public RemoveCommand(ReconciliationEngine engine, DependencyValidator validator,
                         InstallationStateRepository stateRepository) {
        this.engine = engine;
        this.validator = validator;
        this.stateRepository = stateRepository;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (dryRun) {
            List<String> installed = stateRepository.loadOrEmpty().selectedProfiles();
            boolean allowed = true;
            for (String id : profiles) {
                ValidationResult check = validator.validateRemoval(id, installed);
                check.errors().forEach(e -> ConsoleOutput.issue(e, true));
                check.warnings().forEach(w -> ConsoleOutput.issue(w, false));
                if (check.valid()) {
                    ConsoleOutput.success(id + " can be removed");
                } else {
                    allowed = false;
                }
            }
            return allowed ? 0 : 1;
        }

        ReconciliationOutcome outcome = engine.removeProfiles(profiles);
        ConsoleOutput.outcome(outcome);
        return outcome.isCommitted() ? 0 : 1;
    }
}
