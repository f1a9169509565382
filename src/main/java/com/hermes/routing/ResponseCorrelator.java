package com.hermes.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hermes.containers.ContainerClaimCoordinator;
import com.hermes.observability.HermesMetrics;
import com.hermes.queues.QueueTransport;
import com.hermes.shared.model.QueuePair;
import com.hermes.shared.model.ResponseEnvelope;
import com.hermes.store.ConcurrentUpdateException;
import com.hermes.store.Versioned;
import com.hermes.store.VersionedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pulls worker responses off an output queue and attaches them to the command
 * they answer. Redelivered responses are acknowledged and ignored.
 */
public class ResponseCorrelator {

    private static final Logger log = LoggerFactory.getLogger(ResponseCorrelator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();
    private static final int MAX_ATTEMPTS = 5;

    private final QueueTransport transport;
    private final VersionedStore<CommandRecord> commands;
    private final ContainerClaimCoordinator claims;
    private final HermesMetrics metrics;
    private final Duration visibilityTimeout;
    private final int batchSize;

    public ResponseCorrelator(QueueTransport transport, VersionedStore<CommandRecord> commands,
                              ContainerClaimCoordinator claims, HermesMetrics metrics,
                              Duration visibilityTimeout, int batchSize) {
        this.transport = transport;
        this.commands = commands;
        this.claims = claims;
        this.metrics = metrics;
        this.visibilityTimeout = visibilityTimeout;
        this.batchSize = batchSize;
    }

    /** Receives one batch from the pair's output queue. Returns the newly correlated responses. */
    public List<ResponseEnvelope> drain(QueuePair pair) {
        var correlated = new ArrayList<ResponseEnvelope>();
        for (var message : transport.receive(pair.outputQueue(), batchSize, visibilityTimeout)) {
            ResponseEnvelope response;
            try {
                response = MAPPER.readValue(message.body(), ResponseEnvelope.class);
            } catch (JsonProcessingException e) {
                log.warn("Unreadable response {} on {} (delivery {}): {}", message.messageId(),
                        pair.outputQueue(), message.receiveCount(), e.getOriginalMessage());
                continue;
            }
            if (correlate(response)) {
                correlated.add(response);
            }
            claims.recordActivity(pair.affinityGroup());
            transport.acknowledge(pair.outputQueue(), message.receiptHandle());
        }
        return correlated;
    }

    /** Attaches the response to its command. False for unknown commands and duplicates. */
    public boolean correlate(ResponseEnvelope response) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            var current = commands.get(response.commandId());
            if (current.isEmpty()) {
                log.warn("Response for unknown command {} (session {})", response.commandId(), response.sessionId());
                return false;
            }
            if (current.get().value().completed()) {
                log.debug("Duplicate response for command {}", response.commandId());
                return false;
            }
            if (commands.replace(response.commandId(), current.get().version(),
                    current.get().value().withResponse(response))) {
                metrics.responsesCorrelated().increment();
                log.info("Command {} completed for session {} (success={})", response.commandId(),
                        response.sessionId(), response.success());
                return true;
            }
        }
        throw new ConcurrentUpdateException("Command " + response.commandId() + " kept changing");
    }

    public Optional<CommandRecord> lookup(String commandId) {
        return commands.get(commandId).map(Versioned::value);
    }

    /**
     * Drains the pair until the command has a response or the timeout passes.
     * Responses for other commands picked up on the way are correlated too.
     */
    public Optional<ResponseEnvelope> awaitResponse(QueuePair pair, String commandId,
                                                    Duration timeout, Duration pollInterval) {
        var deadline = Instant.now().plus(timeout);
        while (true) {
            var record = lookup(commandId);
            if (record.isPresent() && record.get().completed()) {
                return Optional.of(record.get().response());
            }
            if (Instant.now().isAfter(deadline)) {
                log.warn("Timed out waiting for response to command {}", commandId);
                return Optional.empty();
            }
            if (drain(pair).isEmpty()) {
                sleep(pollInterval);
            }
        }
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a response", e);
        }
    }
}
