package com.hermes.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/** {@code teardownStartedAt} is set while the pair's queues are being deleted. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueuePair(
    AffinityGroup affinityGroup,
    String inputQueue,
    String outputQueue,
    Instant createdAt,
    Instant teardownStartedAt
) {

    public QueuePair(AffinityGroup affinityGroup, String inputQueue, String outputQueue, Instant createdAt) {
        this(affinityGroup, inputQueue, outputQueue, createdAt, null);
    }

    @JsonIgnore
    public boolean tearingDown() {
        return teardownStartedAt != null;
    }

    public QueuePair withTeardownStartedAt(Instant startedAt) {
        return new QueuePair(affinityGroup, inputQueue, outputQueue, createdAt, startedAt);
    }
}
