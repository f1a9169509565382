package com.hermes.shared.model;

/** What a caller hands the router; the router stamps id and timestamp. */
public record CommandRequest(
    String sessionId,
    CommandType type,
    String instruction,
    String userEmail,
    String threadId,
    CommandContext context
) {}
