package com.kaspaaio.dispatch.cli;

import com.kaspaaio.core.error.EngineException;
import com.kaspaaio.lifecycle.ServiceLifecycleManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: kaspa-aio service start|stop|restart &lt;container&gt;...
 * <p>
 * Operates on existing containers only; nothing is created, removed or written.
 */
@Command(name = "service", mixinStandardHelpOptions = true,
        description = "Start, stop or restart installed service containers")
@Component
public class ServiceCommand implements Callable<Integer> {

    enum Action { start, stop, restart }

    @Parameters(index = "0", description = "Action: ${COMPLETION-CANDIDATES}")
    private Action action;

    @Parameters(index = "1..*", arity = "1..*", description = "Container names")
    private List<String> containers;

    private final ServiceLifecycleManager lifecycle;

    public ServiceCommand(ServiceLifecycleManager lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        int failures = 0;
        for (String name : containers) {
            try {
                switch (action) {
                    case start -> lifecycle.start(name);
                    case stop -> lifecycle.stop(name);
                    case restart -> lifecycle.restart(name);
                }
                ConsoleOutput.success(action + " " + name);
            } catch (EngineException e) {
                ConsoleOutput.error(e.getError());
                failures++;
            }
        }
        return failures == 0 ? 0 : 1;
    }
}
