package com.kaspaaio.lifecycle;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.BuildImageResultCallback;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Ports;
import com.github.dockerjava.api.model.RestartPolicy;
import com.kaspaaio.core.config.ComposeService;
import com.kaspaaio.core.error.EngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * {@link ContainerEngine} backed by the local Docker daemon through docker-java.
 *
 * <p>Each compose block becomes one container named after its {@code container_name},
 * attached to the shared bridge network and labelled with its owning profiles so
 * containers created by the installer can be told apart from the operator's own.
 */
public class DockerContainerEngine implements ContainerEngine {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerEngine.class);

    static final String SERVICE_LABEL = "io.kaspa-aio.service";
    static final String PROFILES_LABEL = "io.kaspa-aio.profiles";

    private final DockerClient dockerClient;
    private final Clock clock;

    public DockerContainerEngine(DockerClient dockerClient) {
        this(dockerClient, Clock.systemUTC());
    }

    DockerContainerEngine(DockerClient dockerClient, Clock clock) {
        this.dockerClient = dockerClient;
        this.clock = clock;
    }

    @Override
    public String create(ComposeService service, Path installRoot) {
        String name = service.containerName();
        remove(name);

        var exposed = new ArrayList<ExposedPort>();
        var ports = new Ports();
        for (String mapping : service.ports()) {
            String[] parts = mapping.split(":");
            if (parts.length != 2) {
                throw new EngineException(name, "Malformed port mapping '" + mapping + "'");
            }
            ExposedPort port = ExposedPort.tcp(Integer.parseInt(parts[1]));
            exposed.add(port);
            ports.bind(port, Ports.Binding.bindPort(Integer.parseInt(parts[0])));
        }

        var binds = new ArrayList<Bind>();
        for (String volume : service.volumes()) {
            binds.add(Bind.parse(resolveHostPath(volume, installRoot)));
        }

        var env = new ArrayList<String>();
        service.environment().forEach((k, v) -> env.add(k + "=" + v));

        var labels = new LinkedHashMap<String, String>();
        labels.put(SERVICE_LABEL, name);
        labels.put(PROFILES_LABEL, String.join(",", service.profiles()));

        var hostConfig = HostConfig.newHostConfig()
                .withPortBindings(ports)
                .withBinds(binds)
                .withRestartPolicy(RestartPolicy.unlessStoppedRestart());
        if (!service.networks().isEmpty()) {
            hostConfig.withNetworkMode(service.networks().get(0));
        }

        try {
            var response = dockerClient.createContainerCmd(service.runImage())
                    .withName(name)
                    .withHostConfig(hostConfig)
                    .withExposedPorts(exposed)
                    .withEnv(env)
                    .withLabels(labels)
                    .exec();
            log.info("Created container {} (image {}, id {})", name, service.runImage(), response.getId());
            return response.getId();
        } catch (RuntimeException e) {
            throw new EngineException(name, "Cannot create container " + name + ": " + e.getMessage(), e);
        }
    }

    /** Relative host paths ({@code ./data/...}) are anchored at the install root. */
    static String resolveHostPath(String volume, Path installRoot) {
        int sep = volume.indexOf(':');
        if (sep <= 0) {
            return volume;
        }
        String host = volume.substring(0, sep);
        if (host.startsWith("./") || host.startsWith("../") || host.equals(".")) {
            host = installRoot.resolve(host).normalize().toString();
        }
        return host + volume.substring(sep);
    }

    @Override
    public void start(String containerName) {
        try {
            dockerClient.startContainerCmd(containerName).exec();
            log.info("Started container {}", containerName);
        } catch (NotModifiedException e) {
            log.debug("Container {} already running", containerName);
        } catch (RuntimeException e) {
            throw new EngineException(containerName, "Cannot start " + containerName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void stop(String containerName, int timeoutSeconds) {
        try {
            dockerClient.stopContainerCmd(containerName).withTimeout(timeoutSeconds).exec();
            log.info("Stopped container {}", containerName);
        } catch (NotFoundException | NotModifiedException e) {
            log.debug("Container {} not running: {}", containerName, e.getMessage());
        } catch (RuntimeException e) {
            throw new EngineException(containerName, "Cannot stop " + containerName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void remove(String containerName) {
        try {
            dockerClient.removeContainerCmd(containerName).withForce(true).exec();
            log.info("Removed container {}", containerName);
        } catch (NotFoundException e) {
            log.debug("Container {} does not exist", containerName);
        } catch (RuntimeException e) {
            throw new EngineException(containerName, "Cannot remove " + containerName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ContainerStatus inspect(String containerName) {
        try {
            InspectContainerResponse response = dockerClient.inspectContainerCmd(containerName).exec();
            var state = response.getState();
            String health = state != null && state.getHealth() != null ? state.getHealth().getStatus() : null;
            String image = response.getConfig() != null ? response.getConfig().getImage() : null;
            return new ContainerStatus(containerName,
                    ContainerStatus.State.fromDocker(state != null ? state.getStatus() : null),
                    image, health, clock.instant());
        } catch (NotFoundException e) {
            return ContainerStatus.missing(containerName, clock.instant());
        } catch (RuntimeException e) {
            throw new EngineException(containerName, "Cannot inspect " + containerName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void pullImage(String image, Duration timeout) {
        log.info("Pulling image {}", image);
        boolean completed;
        try (var callback = dockerClient.pullImageCmd(image).exec(new PullImageResultCallback())) {
            completed = callback.awaitCompletion(timeout.toSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException(image, "Pulling " + image + " was cancelled", e);
        } catch (IOException | RuntimeException e) {
            throw new EngineException(image, "Cannot pull " + image + ": " + e.getMessage(), e);
        }
        if (!completed) {
            throw new EngineException(image, "Pulling " + image + " timed out after " + timeout);
        }
    }

    @Override
    public void buildImage(Path context, String dockerfile, String tag, Map<String, String> args, Duration timeout) {
        log.info("Building image {} from {}", tag, context);
        var cmd = dockerClient.buildImageCmd(context.toFile())
                .withDockerfile(context.resolve(dockerfile).toFile())
                .withTags(Set.of(tag));
        args.forEach(cmd::withBuildArg);
        try {
            String imageId = cmd.exec(new BuildImageResultCallback())
                    .awaitImageId(timeout.toSeconds(), TimeUnit.SECONDS);
            log.info("Built image {} ({})", tag, imageId);
        } catch (RuntimeException e) {
            throw new EngineException(tag, "Cannot build " + tag + " from " + context + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void ensureNetwork(String name) {
        try {
            boolean exists = dockerClient.listNetworksCmd().withNameFilter(name).exec().stream()
                    .anyMatch(n -> name.equals(n.getName()));
            if (!exists) {
                dockerClient.createNetworkCmd().withName(name).withDriver("bridge").exec();
                log.info("Created network {}", name);
            }
        } catch (RuntimeException e) {
            throw new EngineException(name, "Cannot create network " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean ping() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (RuntimeException e) {
            log.debug("Docker ping failed: {}", e.getMessage());
            return false;
        }
    }
}
