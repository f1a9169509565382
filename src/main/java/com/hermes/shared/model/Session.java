package com.hermes.shared.model;

import java.time.Instant;

public record Session(
    String sessionId,
    String clientId,
    String projectId,
    String userId,
    String threadId,
    String gitBranch,
    Channel source,
    Instant createdAt,
    Instant lastActivity,
    int messageCount
) {

    public static Session create(String clientId, String projectId, String userId,
                                 String threadId, Channel source, Instant now) {
        return new Session(sessionIdFor(clientId, projectId, threadId), clientId, projectId, userId,
                threadId, branchFor(threadId), source, now, now, 1);
    }

    public static String sessionIdFor(String clientId, String projectId, String threadId) {
        return clientId + "-" + projectId + "-" + threadId;
    }

    public static String branchFor(String threadId) {
        return "thread-" + threadId;
    }

    public static String key(String clientId, String projectId, String userId, String threadId) {
        return Keys.join('/', clientId, projectId, userId, threadId);
    }

    public Session touch(Channel newSource, Instant now) {
        return new Session(sessionId, clientId, projectId, userId, threadId, gitBranch,
                newSource, createdAt, now, messageCount + 1);
    }

    public AffinityGroup affinityGroup() {
        return new AffinityGroup(projectId, userId);
    }
}
