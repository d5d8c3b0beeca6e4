package com.kaspaaio.core.config;

public record ComposeNetwork(String driver) {

    public static ComposeNetwork bridge() {
        return new ComposeNetwork("bridge");
    }
}
