package com.kaspaaio.lifecycle;

import java.time.Instant;

/**
 * Observed state of one service container.
 *
 * @param health health check status reported by the runtime, or {@code null} when the
 *               image defines no health check
 */
public record ContainerStatus(
    String containerName,
    State state,
    String image,
    String health,
    Instant observedAt
) {

    public enum State {
        RUNNING, RESTARTING, PAUSED, CREATED, EXITED, MISSING, UNKNOWN;

        public static State fromDocker(String status) {
            if (status == null) return UNKNOWN;
            return switch (status.toLowerCase()) {
                case "running" -> RUNNING;
                case "restarting" -> RESTARTING;
                case "paused" -> PAUSED;
                case "created" -> CREATED;
                case "exited", "dead", "removing" -> EXITED;
                default -> UNKNOWN;
            };
        }
    }

    public static ContainerStatus missing(String containerName, Instant now) {
        return new ContainerStatus(containerName, State.MISSING, null, null, now);
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    public boolean exists() {
        return state != State.MISSING;
    }
}
