package com.kaspaaio.core.catalog;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;
import java.util.TreeMap;

/**
 * Local image build directive: a context directory relative to the install root.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record BuildSpec(String context, String dockerfile, Map<String, String> args) {

    public BuildSpec {
        args = args != null ? new TreeMap<>(args) : new TreeMap<>();
        if (dockerfile == null || dockerfile.isBlank()) {
            dockerfile = "Dockerfile";
        }
    }

    public static BuildSpec of(String context) {
        return new BuildSpec(context, "Dockerfile", Map.of());
    }
}
