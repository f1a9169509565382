package com.hermes.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hermes.observability.HermesMetrics;
import com.hermes.queues.QueueTransport;
import com.hermes.shared.model.AffinityGroup;
import com.hermes.shared.model.CommandContext;
import com.hermes.shared.model.CommandEnvelope;
import com.hermes.shared.model.CommandRequest;
import com.hermes.shared.model.CommandType;
import com.hermes.shared.model.Session;
import com.hermes.store.VersionedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Serialises commands onto an input queue. Each send records the command id so
 * the asynchronous response can be correlated later.
 */
public class MessageEnvelopeRouter {

    private static final Logger log = LoggerFactory.getLogger(MessageEnvelopeRouter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();
    static final String INTERRUPT_INSTRUCTION = "INTERRUPT: Stop current work and prepare for new instruction";

    private final QueueTransport transport;
    private final VersionedStore<CommandRecord> commands;
    private final HermesMetrics metrics;
    private final Clock clock;

    public MessageEnvelopeRouter(QueueTransport transport, VersionedStore<CommandRecord> commands,
                                 HermesMetrics metrics, Clock clock) {
        this.transport = transport;
        this.commands = commands;
        this.metrics = metrics;
        this.clock = clock;
    }

    public String send(String queue, CommandRequest request) {
        return send(queue, request, Map.of());
    }

    public String sendInterrupt(String queue, String sessionId, String threadId, AffinityGroup group) {
        var context = new CommandContext(group, null, Session.branchFor(threadId), null,
                group.projectId(), group.userId());
        var request = new CommandRequest(sessionId, CommandType.INTERRUPT, INTERRUPT_INSTRUCTION,
                null, threadId, context);
        return send(queue, request, Map.of("Priority", "high"));
    }

    private String send(String queue, CommandRequest request, Map<String, String> extraAttributes) {
        var commandId = UUID.randomUUID().toString();
        var envelope = CommandEnvelope.stamp(request, commandId, clock.instant());
        var body = serialize(envelope);

        var attributes = new LinkedHashMap<String, String>();
        attributes.put("Type", request.type().wireName());
        attributes.put("SessionId", request.sessionId());
        if (request.threadId() != null) attributes.put("ThreadId", request.threadId());
        attributes.putAll(extraAttributes);

        var group = request.context() != null ? request.context().affinityGroup() : null;
        commands.putIfAbsent(commandId, new CommandRecord(commandId, request.sessionId(), request.type(),
                group, queue, envelope.timestamp(), null));
        try {
            transport.send(queue, body, attributes);
        } catch (RuntimeException e) {
            // nothing was queued, so nothing will ever answer this id
            commands.get(commandId).ifPresent(record -> commands.delete(commandId, record.version()));
            throw e;
        }
        metrics.commandsSent().increment();
        log.info("Sent {} command {} for session {} to {}", request.type().wireName(), commandId,
                request.sessionId(), queue);
        return commandId;
    }

    private static String serialize(CommandEnvelope envelope) {
        try {
            return MAPPER.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize command for session " + envelope.sessionId(), e);
        }
    }
}
