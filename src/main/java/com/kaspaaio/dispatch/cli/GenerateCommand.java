package com.kaspaaio.dispatch.cli;

import com.kaspaaio.core.config.ConfigGenerator;
import com.kaspaaio.core.config.GeneratedConfiguration;
import com.kaspaaio.core.error.Result;
import com.kaspaaio.core.store.AtomicFiles;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: kaspa-aio generate &lt;profile&gt;... [--set KEY=VALUE]... [--output-dir DIR]
 * <p>
 * Renders the compose document and environment file for a selection. Without an
 * output directory both files are printed; nothing is deployed either way.
 */
@Command(name = "generate", mixinStandardHelpOptions = true,
        description = "Generate docker-compose.yml and .env for a selection")
@Component
public class GenerateCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Profile IDs (already resolved)")
    private List<String> profiles;

    @Option(names = {"--set", "-s"}, description = "Setting override, KEY=VALUE")
    private Map<String, String> settings = new LinkedHashMap<>();

    @Option(names = {"--output-dir", "-o"}, description = "Write the files here instead of printing them")
    private Path outputDir;

    @Option(names = "--defaults", description = "Only print the default settings of the selection")
    private boolean defaultsOnly;

    private final ConfigGenerator generator;

    public GenerateCommand(ConfigGenerator generator) {
        this.generator = generator;
    }

    @Override
    public Integer call() {
        if (defaultsOnly) {
            generator.defaultSettings(profiles).forEach((k, v) -> System.out.println(k + "=" + v));
            return 0;
        }

        Result<GeneratedConfiguration> result = generator.generate(profiles, settings);
        if (!result.isSuccess()) {
            ConsoleOutput.printBanner();
            ConsoleOutput.errors(result.errors());
            return 1;
        }
        GeneratedConfiguration generated = result.orElseThrow();

        if (outputDir == null) {
            System.out.println("# docker-compose.yml");
            System.out.print(generated.composeYaml());
            System.out.println("# .env");
            System.out.print(generated.envFile());
            return 0;
        }

        ConsoleOutput.printBanner();
        try {
            AtomicFiles.write(outputDir.resolve("docker-compose.yml"), generated.composeYaml());
            AtomicFiles.write(outputDir.resolve(".env"), generated.envFile());
        } catch (IOException e) {
            ConsoleOutput.error("Cannot write to " + outputDir + ": " + e.getMessage());
            return 1;
        }
        ConsoleOutput.success("Wrote " + generated.compose().services().size() + " services to "
                + outputDir.toAbsolutePath());
        if (!generated.generatedSecrets().isEmpty()) {
            ConsoleOutput.info("Generated secrets: " + String.join(", ", generated.generatedSecrets()));
        }
        generated.warnings().forEach(ConsoleOutput::warn);
        return 0;
    }
}
