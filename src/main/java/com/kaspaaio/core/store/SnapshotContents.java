package com.kaspaaio.core.store;

import com.kaspaaio.core.config.EnvFile;

import java.util.Map;

/**
 * File contents of a snapshot. Each field is {@code null} when the file did not exist.
 */
public record SnapshotContents(String composeYaml, String envFile, String stateJson) {

    public Map<String, String> env() {
        return EnvFile.parse(envFile);
    }
}
