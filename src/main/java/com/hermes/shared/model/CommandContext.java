package com.hermes.shared.model;

public record CommandContext(
    AffinityGroup affinityGroup,
    Channel channel,
    String branch,
    String clientId,
    String projectId,
    String userId
) {}
