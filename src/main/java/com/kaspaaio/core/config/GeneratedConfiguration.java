package com.kaspaaio.core.config;

import java.util.List;
import java.util.Map;

/**
 * Output of {@link ConfigGenerator#generate}.
 *
 * @param profiles         canonical profile IDs the configuration was generated for
 * @param compose          the orchestration document
 * @param env              environment values written to the env file, sorted by key
 * @param composeYaml      serialized compose document
 * @param envFile          serialized environment file
 * @param generatedSecrets keys whose values were generated because none was supplied
 * @param warnings         non-blocking remarks
 */
public record GeneratedConfiguration(
    List<String> profiles,
    ComposeDocument compose,
    Map<String, String> env,
    String composeYaml,
    String envFile,
    List<String> generatedSecrets,
    List<String> warnings
) {

    public GeneratedConfiguration {
        profiles = List.copyOf(profiles);
        generatedSecrets = List.copyOf(generatedSecrets);
        warnings = List.copyOf(warnings);
    }
}
