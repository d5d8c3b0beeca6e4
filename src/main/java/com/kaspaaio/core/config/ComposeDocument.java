package com.kaspaaio.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compose-equivalent orchestration document. Services keep their startup order.
 */
@JsonPropertyOrder({"services", "networks"})
public record ComposeDocument(
    Map<String, ComposeService> services,
    Map<String, ComposeNetwork> networks
) {

    public ComposeDocument {
        services = services != null ? Collections.unmodifiableMap(new LinkedHashMap<>(services)) : Map.of();
        networks = networks != null ? Collections.unmodifiableMap(new LinkedHashMap<>(networks)) : Map.of();
    }

    public static ComposeDocument empty() {
        return new ComposeDocument(Map.of(), Map.of());
    }

    @JsonIgnore
    public List<String> serviceNames() {
        return List.copyOf(services.keySet());
    }

    public Optional<ComposeService> service(String name) {
        return Optional.ofNullable(services.get(name));
    }

    /** A copy of this document without the named service blocks. */
    public ComposeDocument without(Collection<String> serviceNames) {
        var remaining = new LinkedHashMap<>(services);
        serviceNames.forEach(remaining::remove);
        return new ComposeDocument(remaining, networks);
    }
}
