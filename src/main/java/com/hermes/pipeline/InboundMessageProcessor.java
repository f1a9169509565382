package com.hermes.pipeline;

import com.hermes.containers.ClaimNotFoundException;
import com.hermes.containers.ContainerClaimCoordinator;
import com.hermes.queues.QueueTopologyManager;
import com.hermes.routing.MessageEnvelopeRouter;
import com.hermes.sessions.SessionRegistry;
import com.hermes.shared.model.AffinityGroup;
import com.hermes.shared.model.CommandContext;
import com.hermes.shared.model.CommandRequest;
import com.hermes.shared.model.CommandType;
import com.hermes.shared.model.EmailMessage;
import com.hermes.shared.model.InboundMessage;
import com.hermes.shared.model.ProjectRoute;
import com.hermes.shared.retry.ResilientCall;
import com.hermes.threads.ThreadIdResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Runs one inbound message through thread resolution, session lookup, queue
 * provisioning, container claim and dispatch. Each networked step is retried on
 * its own.
 */
public class InboundMessageProcessor {

    private static final Logger log = LoggerFactory.getLogger(InboundMessageProcessor.class);

    private final ThreadIdResolver threads;
    private final SessionRegistry sessions;
    private final QueueTopologyManager queues;
    private final ContainerClaimCoordinator claims;
    private final MessageEnvelopeRouter router;
    private final SenderDirectory directory;
    private final int maxRetries;
    private final long baseDelayMs;

    public InboundMessageProcessor(ThreadIdResolver threads, SessionRegistry sessions,
                                   QueueTopologyManager queues, ContainerClaimCoordinator claims,
                                   MessageEnvelopeRouter router, SenderDirectory directory) {
        this(threads, sessions, queues, claims, router, directory, 2, 200);
    }

    public InboundMessageProcessor(ThreadIdResolver threads, SessionRegistry sessions,
                                   QueueTopologyManager queues, ContainerClaimCoordinator claims,
                                   MessageEnvelopeRouter router, SenderDirectory directory,
                                   int maxRetries, long baseDelayMs) {
        this.threads = threads;
        this.sessions = sessions;
        this.queues = queues;
        this.claims = claims;
        this.router = router;
        this.directory = directory;
        this.maxRetries = maxRetries;
        this.baseDelayMs = baseDelayMs;
    }

    public DispatchResult process(InboundMessage inbound) {
        if (inbound.message() == null) throw new IllegalArgumentException("message is required");
        if (inbound.instruction() == null || inbound.instruction().isBlank()) {
            throw new IllegalArgumentException("instruction is required");
        }
        var route = routeFor(inbound);
        var channel = inbound.message().channel();
        var threadId = threads.extractThreadId(inbound.message());

        var session = retry(() -> sessions.getOrCreateSession(
                route.clientId(), route.projectId(), route.userId(), threadId, channel));
        var group = new AffinityGroup(route.projectId(), route.userId());
        retry(() -> queues.createAffinityQueues(group));
        var containerId = activate(group);
        // read again under the claim: a queue deletion that started before it has now either backed off or finished
        var pair = retry(() -> queues.createAffinityQueues(group));

        var type = inbound.type() != null ? inbound.type() : CommandType.EDIT;
        var context = new CommandContext(group, channel, session.gitBranch(),
                route.clientId(), route.projectId(), route.userId());
        var request = new CommandRequest(session.sessionId(), type, inbound.instruction(),
                userEmail(inbound), threadId, context);
        var commandId = retry(() -> router.send(pair.inputQueue(), request));

        log.info("Dispatched {} for session {} to container {}", commandId, session.sessionId(), containerId);
        return new DispatchResult(session, pair, containerId, commandId);
    }

    private String activate(AffinityGroup group) {
        retry(() -> claims.claim(group));
        try {
            return retry(() -> claims.markActive(group)).containerId();
        } catch (ClaimNotFoundException e) {
            // released by the sweeper between claim and dispatch
            log.info("Claim for {} vanished before dispatch, claiming again", group.key());
            retry(() -> claims.claim(group));
            return retry(() -> claims.markActive(group)).containerId();
        }
    }

    private ProjectRoute routeFor(InboundMessage inbound) {
        if (present(inbound.clientId()) && present(inbound.projectId()) && present(inbound.userId())) {
            return new ProjectRoute(inbound.message().sender(), inbound.clientId(), inbound.projectId(), inbound.userId());
        }
        return directory.resolve(inbound.message());
    }

    private static String userEmail(InboundMessage inbound) {
        return inbound.message() instanceof EmailMessage email ? email.from() : null;
    }

    private <T> T retry(Callable<T> action) {
        return ResilientCall.execute(action, maxRetries, baseDelayMs);
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
