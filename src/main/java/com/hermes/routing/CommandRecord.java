package com.hermes.routing;

import com.hermes.shared.model.AffinityGroup;
import com.hermes.shared.model.CommandType;
import com.hermes.shared.model.ResponseEnvelope;

import java.time.Instant;

public record CommandRecord(
    String commandId,
    String sessionId,
    CommandType type,
    AffinityGroup affinityGroup,
    String inputQueue,
    Instant sentAt,
    ResponseEnvelope response
) {

    public CommandRecord withResponse(ResponseEnvelope envelope) {
        return new CommandRecord(commandId, sessionId, type, affinityGroup, inputQueue, sentAt, envelope);
    }

    public boolean completed() {
        return response != null;
    }
}
