package com.kaspaaio.lifecycle;

import com.kaspaaio.core.config.ComposeService;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Narrow view of the container runtime. Everything the installer does to live
 * containers goes through this interface.
 * Implementations: {@link DockerContainerEngine}.
 *
 * <p>Failures are raised as {@link com.kaspaaio.core.error.EngineException}.
 */
public interface ContainerEngine {

    /**
     * Creates the container described by a compose block, replacing any existing
     * container with the same name. The container is not started.
     *
     * @param installRoot directory relative volume paths are resolved against
     * @return the container ID
     */
    String create(ComposeService service, Path installRoot);

    void start(String containerName);

    /** Stops a container. A container that does not exist counts as stopped. */
    void stop(String containerName, int timeoutSeconds);

    /** Removes a container. A container that does not exist counts as removed. */
    void remove(String containerName);

    ContainerStatus inspect(String containerName);

    /** Pulls an image, blocking until done or until {@code timeout} elapses. */
    void pullImage(String image, Duration timeout);

    /** Builds an image from a local context directory and tags it. */
    void buildImage(Path context, String dockerfile, String tag, Map<String, String> args, Duration timeout);

    /** Ensures the bridge network the services are attached to exists. */
    void ensureNetwork(String name);

    /** @return true when the runtime answers */
    boolean ping();
}
