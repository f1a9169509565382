package com.hermes.shared.config;

import java.util.Map;

public record HermesConfig(
    int serverPort,
    String store,
    Map<String, String> database,
    QueueConfig queues,
    ClaimConfig claims,
    ContainerConfig containers,
    RoutingConfig routing
) {
    public boolean usePostgres() {
        return "postgres".equalsIgnoreCase(store);
    }
}
