package com.kaspaaio.core.health;

import com.kaspaaio.lifecycle.ContainerEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the container engine. Reports UP when the daemon
 * answers a ping, DOWN otherwise.
 */
@Component("containerEngineHealthIndicator")
@ConditionalOnProperty(name = "kaspa-aio.engine.provider", havingValue = "docker", matchIfMissing = true)
public class ContainerEngineHealthIndicator implements HealthIndicator {

    private final ContainerEngine engine;

    public ContainerEngineHealthIndicator(ContainerEngine engine) {
        this.engine = engine;
    }

    @Override
    public Health health() {
        var builder = engine.ping() ? Health.up() : Health.down();
        return builder.withDetail("engine", engine.getClass().getSimpleName()).build();
    }
}
