package com.kaspaaio.lifecycle;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class EngineConfig {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    @ConditionalOnProperty(name = "kaspa-aio.engine.provider", havingValue = "docker", matchIfMissing = true)
    public DockerClient dockerClient(AioProperties properties) {
        String dockerHost = properties.getEngine().getDockerHost();
        if (dockerHost == null || dockerHost.isBlank()) {
            dockerHost = System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        }
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // Image pulls and builds stream for minutes; the per-operation timeout is enforced by the engine
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .connectionTimeout(Duration.ofSeconds(30))
                .responseTimeout(properties.getImageTimeout())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "kaspa-aio.engine.provider", havingValue = "docker", matchIfMissing = true)
    public ContainerEngine dockerContainerEngine(DockerClient dockerClient) {
        return new DockerContainerEngine(dockerClient);
    }
}
