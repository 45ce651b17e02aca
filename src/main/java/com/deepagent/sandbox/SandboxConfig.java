package com.deepagent.sandbox;

import com.deepagent.backend.BackendProperties;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "deepagent.sandbox.enabled", havingValue = "true", matchIfMissing = true)
public class SandboxConfig {

    @Bean
    public DockerClient dockerClient(SandboxProperties properties) {
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(properties.resolveDockerHost())
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public DockerSandboxManager dockerSandboxManager(DockerClient dockerClient,
                                                     SandboxProperties sandboxProperties,
                                                     BackendProperties backendProperties) {
        return new DockerSandboxManager(dockerClient, sandboxProperties, backendProperties);
    }
}
