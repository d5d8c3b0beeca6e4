package com.kaspaaio.dispatch.cli;

import com.kaspaaio.core.engine.ReconciliationEngine;
import com.kaspaaio.core.engine.ReconciliationOutcome;
import com.kaspaaio.core.engine.ReconfigurationRequest;
import com.kaspaaio.core.events.AioEvent;
import com.kaspaaio.core.events.EventBus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: kaspa-aio reconfigure &lt;profile&gt;... [--set KEY=VALUE]...
 * <p>
 * Moves the installation to the given selection. A backup is taken first and
 * the change is rolled back if any step fails.
 */
@Command(name = "reconfigure", aliases = "install", mixinStandardHelpOptions = true,
        description = "Install or reconfigure the stack to the given profiles")
@Component
public class ReconfigureCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Full desired profile selection")
    private List<String> profiles;

    @Option(names = {"--set", "-s"}, description = "Setting override, KEY=VALUE")
    private Map<String, String> settings = new LinkedHashMap<>();

    @Option(names = "--reason", description = "Reason recorded in the backup", defaultValue = "reconfigure")
    private String reason;

    @Option(names = {"--quiet", "-q"}, description = "Do not print progress events")
    private boolean quiet;

    private final ReconciliationEngine engine;
    private final EventBus eventBus;

    public ReconfigureCommand(ReconciliationEngine engine, EventBus eventBus) {
        this.engine = engine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Reconfiguring to " + String.join(", ", profiles));

        EventBus.Subscription subscription = quiet ? null : eventBus.subscribeAll(this::print);
        ReconciliationOutcome outcome;
        try {
            outcome = engine.reconcile(new ReconfigurationRequest(profiles, settings, reason));
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
        ConsoleOutput.outcome(outcome);
        return outcome.isCommitted() ? 0 : 1;
    }

    private void print(AioEvent event) {
        String subject = event.service() != null ? event.service() : event.reconciliationId();
        Object detail = event.payload().get("message");
        ConsoleOutput.event(event.eventType(), detail != null ? subject + " " + detail : subject);
    }
}
