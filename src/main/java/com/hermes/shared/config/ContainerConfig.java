package com.hermes.shared.config;

public record ContainerConfig(
    String launcher,
    String image,
    String memory,
    String cpus,
    int pidsLimit,
    int warmPoolSize,
    long launchTimeoutSeconds
) {
    public static ContainerConfig defaults() {
        return new ContainerConfig("none", "hermes-worker:latest", "2g", "1.0", 256, 2, 60);
    }
}
