package com.kaspaaio.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for the Kaspa All-in-One installer.
 */
@Command(
        name = "kaspa-aio",
        mixinStandardHelpOptions = true,
        version = "Kaspa All-in-One 0.1.0",
        description = "Install and reconfigure a multi-service Kaspa stack",
        subcommands = {
                ProfilesCommand.class,
                ValidateCommand.class,
                GenerateCommand.class,
                ReconfigureCommand.class,
                RemoveCommand.class,
                BackupCommand.class,
                StatusCommand.class,
                ServiceCommand.class,
                HistoryCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class KaspaAioCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
