package com.hermes.shared.model;

/**
 * A message entering the pipeline. Client, project and user may be left null,
 * in which case they are looked up from the sender.
 */
public record InboundMessage(
    String clientId,
    String projectId,
    String userId,
    ThreadMessage message,
    String instruction,
    CommandType type
) {}
