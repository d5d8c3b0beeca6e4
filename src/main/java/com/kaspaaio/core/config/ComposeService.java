package com.kaspaaio.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.kaspaaio.core.catalog.BuildSpec;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One service block of the compose document.
 *
 * @param profiles the owning profiles that caused this block to be emitted
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"container_name", "image", "build", "restart", "ports", "environment", "volumes", "networks",
        "profiles"})
public record ComposeService(
    @JsonProperty("container_name") String containerName,
    String image,
    BuildSpec build,
    String restart,
    List<String> ports,
    Map<String, String> environment,
    List<String> volumes,
    List<String> networks,
    List<String> profiles
) {

    public ComposeService {
        ports = ports != null ? List.copyOf(ports) : List.of();
        environment = environment != null ? new TreeMap<>(environment) : new TreeMap<>();
        volumes = volumes != null ? List.copyOf(volumes) : List.of();
        networks = networks != null ? List.copyOf(networks) : List.of();
        profiles = profiles != null ? List.copyOf(profiles) : List.of();
    }

    /** Image the engine runs: the pulled image, or the tag a local build produces. */
    public String runImage() {
        return image != null ? image : "kaspa-aio/" + containerName + ":local";
    }
}
