package com.hermes.shared.config;

import com.hermes.shared.model.ProjectRoute;

import java.util.List;

public record RoutingConfig(
    List<ProjectRoute> routes,
    ProjectRoute fallback
) {
    public static RoutingConfig defaults() {
        return new RoutingConfig(List.of(), new ProjectRoute(null, "default", "default", "unknown"));
    }
}
