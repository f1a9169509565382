package com.hermes.gateway.http;

import com.hermes.containers.ContainerClaimCoordinator;
import com.hermes.observability.DoctorCommand;
import com.hermes.pipeline.DispatchResult;
import com.hermes.pipeline.InboundMessageProcessor;
import com.hermes.routing.CommandRecord;
import com.hermes.routing.ResponseCorrelator;
import com.hermes.shared.model.AffinityGroup;
import com.hermes.shared.model.InboundMessage;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class InboundController {

    private final InboundMessageProcessor processor;
    private final ResponseCorrelator correlator;
    private final ContainerClaimCoordinator claims;
    private final DoctorCommand doctor;

    public InboundController(InboundMessageProcessor processor, ResponseCorrelator correlator,
                             ContainerClaimCoordinator claims, DoctorCommand doctor) {
        this.processor = processor;
        this.correlator = correlator;
        this.claims = claims;
        this.doctor = doctor;
    }

    @PostMapping("/v1/messages")
    public DispatchResult receive(@RequestBody InboundMessage inbound) {
        return processor.process(inbound);
    }

    @GetMapping("/v1/commands/{commandId}")
    public CommandRecord command(@PathVariable("commandId") String commandId) {
        return correlator.lookup(commandId)
                .orElseThrow(() -> new CommandNotFoundException(commandId));
    }

    @GetMapping("/v1/claims/{projectId}/{userId}")
    public Map<String, Object> claim(@PathVariable("projectId") String projectId,
                                     @PathVariable("userId") String userId) {
        var group = new AffinityGroup(projectId, userId);
        var body = new LinkedHashMap<String, Object>();
        body.put("affinityGroup", group.key());
        body.put("status", claims.status(group));
        claims.find(group).ifPresent(claim -> {
            body.put("containerId", claim.containerId());
            body.put("claimedAt", claim.claimedAt().toString());
            body.put("lastActivity", claim.lastActivity().toString());
        });
        return body;
    }

    @GetMapping(value = "/v1/doctor", produces = MediaType.TEXT_PLAIN_VALUE)
    public String doctor() {
        return doctor.run();
    }
}
