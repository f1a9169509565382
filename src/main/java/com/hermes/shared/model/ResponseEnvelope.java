package com.hermes.shared.model;

import java.time.Instant;
import java.util.List;

public record ResponseEnvelope(
    String commandId,
    String sessionId,
    boolean success,
    String summary,
    List<String> filesChanged,
    String error,
    String previewUrl,
    boolean interrupted,
    Instant completedAt
) {}
