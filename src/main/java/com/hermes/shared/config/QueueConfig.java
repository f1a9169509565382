package com.hermes.shared.config;

public record QueueConfig(
    String prefix,
    int visibilityTimeoutSeconds,
    int responseBatchSize
) {
    public static QueueConfig defaults() {
        return new QueueConfig("hermes", 300, 10);
    }
}
