package com.hermes.shared.model;

public record ProjectRoute(
    String sender,
    String clientId,
    String projectId,
    String userId
) {}
