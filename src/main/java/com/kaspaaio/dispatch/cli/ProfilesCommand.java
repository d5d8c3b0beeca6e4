package com.kaspaaio.dispatch.cli;

import com.kaspaaio.core.catalog.Profile;
import com.kaspaaio.core.catalog.ProfileCatalog;
import com.kaspaaio.core.catalog.ProfileIdMigration;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.stream.Collectors;

/**
 * CLI command: kaspa-aio profiles
 * <p>
 * Lists the profile catalog with services and host ports.
 */
@Command(name = "profiles", mixinStandardHelpOptions = true, description = "List available profiles")
@Component
public class ProfilesCommand implements Runnable {

    private final ProfileCatalog catalog;

    public ProfilesCommand(ProfileCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        System.out.printf("  %-24s %-44s %s%n", "PROFILE", "SERVICES", "PORTS");
        System.out.println("  " + "-".repeat(84));
        for (Profile profile : catalog.all()) {
            String ports = profile.ports().stream().map(String::valueOf).collect(Collectors.joining(","));
            System.out.printf("  %-24s %-44s %s%n", profile.id(),
                    ConsoleOutput.truncate(String.join(", ", profile.serviceNames()), 44),
                    ports.isEmpty() ? "-" : ports);
        }
        System.out.println();
        ConsoleOutput.info("Legacy IDs (migration table v" + ProfileIdMigration.VERSION + "):");
        ProfileIdMigration.table().forEach((legacy, ids) ->
                System.out.println("  " + legacy + " -> " + String.join(", ", ids)));
    }
}
