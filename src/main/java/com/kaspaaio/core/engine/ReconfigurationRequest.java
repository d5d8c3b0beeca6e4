package com.kaspaaio.core.engine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Desired installation: the full profile selection plus setting overrides. Settings
 * not mentioned keep their previously committed values.
 */
public record ReconfigurationRequest(
    List<String> profiles,
    Map<String, String> settings,
    String reason
) {

    public ReconfigurationRequest {
        profiles = profiles != null ? List.copyOf(profiles) : List.of();
        settings = settings != null ? new LinkedHashMap<>(settings) : new LinkedHashMap<>();
        reason = reason != null && !reason.isBlank() ? reason : "reconfigure";
    }
}
