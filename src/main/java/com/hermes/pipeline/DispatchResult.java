package com.hermes.pipeline;

import com.hermes.shared.model.QueuePair;
import com.hermes.shared.model.Session;

public record DispatchResult(
    Session session,
    QueuePair queues,
    String containerId,
    String commandId
) {}
