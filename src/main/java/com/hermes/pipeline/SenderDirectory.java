package com.hermes.pipeline;

import com.hermes.shared.config.RoutingConfig;
import com.hermes.shared.model.ProjectRoute;
import com.hermes.shared.model.ThreadMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/** Maps a channel sender (email address, phone number, chat user) to its client/project/user. */
public class SenderDirectory {

    private static final Logger log = LoggerFactory.getLogger(SenderDirectory.class);
    private static final Pattern ANGLE_ADDRESS = Pattern.compile("<([^>]+)>");

    private final Map<String, ProjectRoute> routes = new HashMap<>();
    private final ProjectRoute fallback;

    public SenderDirectory(RoutingConfig config) {
        for (var route : config.routes()) {
            if (route.sender() != null) routes.put(normalize(route.sender()), route);
        }
        this.fallback = config.fallback();
    }

    public ProjectRoute resolve(ThreadMessage message) {
        var sender = message.sender();
        if (sender != null) {
            var route = routes.get(normalize(sender));
            if (route != null) return route;
        }
        log.warn("No route for {} sender {}, using fallback {}/{}", message.channel().wireName(), sender,
                fallback.projectId(), fallback.userId());
        return fallback;
    }

    // "Jane <jane@example.com>" and "JANE@example.com" both match jane@example.com
    static String normalize(String sender) {
        var m = ANGLE_ADDRESS.matcher(sender);
        var address = m.find() ? m.group(1) : sender;
        return address.trim().toLowerCase(Locale.ROOT);
    }
}
