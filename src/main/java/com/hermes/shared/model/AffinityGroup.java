package com.hermes.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/** The (project, user) scope that owns one claimed container and one queue pair. */
public record AffinityGroup(String projectId, String userId) {

    public AffinityGroup {
        if (projectId == null || projectId.isBlank()) throw new IllegalArgumentException("projectId is required");
        if (userId == null || userId.isBlank()) throw new IllegalArgumentException("userId is required");
    }

    @JsonIgnore
    public String key() {
        return Keys.join('#', projectId, userId);
    }
}
