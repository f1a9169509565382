package com.hermes.shared.model;

import java.time.Instant;

public record CommandEnvelope(
    String commandId,
    String sessionId,
    CommandType type,
    String instruction,
    String userEmail,
    String threadId,
    Instant timestamp,
    CommandContext context
) {

    public static CommandEnvelope stamp(CommandRequest request, String commandId, Instant now) {
        return new CommandEnvelope(commandId, request.sessionId(), request.type(), request.instruction(),
                request.userEmail(), request.threadId(), now, request.context());
    }
}
