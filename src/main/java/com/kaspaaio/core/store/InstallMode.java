package com.kaspaaio.core.store;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum InstallMode {
    @JsonProperty("initial") INITIAL,
    @JsonProperty("reconfigure") RECONFIGURE
}
