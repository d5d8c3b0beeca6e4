package com.kaspaaio.dispatch.cli;

import com.kaspaaio.core.catalog.ResourceRequirements;
import com.kaspaaio.core.validation.DependencyValidator;
import com.kaspaaio.core.validation.ValidationResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: kaspa-aio validate &lt;profile&gt;...
 * <p>
 * Checks a selection for dependency, conflict, port and resource problems without
 * changing anything. Exits non-zero when the selection has errors.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate a profile selection")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(arity = "0..*", description = "Profile IDs")
    private List<String> profiles = List.of();

    private final DependencyValidator validator;

    public ValidateCommand(DependencyValidator validator) {
        this.validator = validator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ValidationResult result = validator.validateSelection(profiles);

        result.errors().forEach(e -> ConsoleOutput.issue(e, true));
        result.warnings().forEach(w -> ConsoleOutput.issue(w, false));
        if (!result.valid()) {
            ConsoleOutput.error("Selection is not valid");
            return 1;
        }

        ConsoleOutput.success("Resolved profiles: " + String.join(", ", result.resolvedProfiles()));
        ConsoleOutput.info("Startup order:");
        result.startupPlan().phases().forEach((phase, services) ->
                System.out.println("  " + phase.order() + ". " + phase.name().toLowerCase() + ": "
                        + String.join(", ", services)));
        ResourceRequirements r = result.resources();
        ConsoleOutput.info(String.format("Minimum: %d CPU, %d GB RAM, %d GB disk (recommended %d / %d / %d)",
                r.minCpu(), r.minMemoryGb(), r.minDiskGb(),
                r.recommendedCpu(), r.recommendedMemoryGb(), r.recommendedDiskGb()));
        return 0;
    }
}
