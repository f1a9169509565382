package com.hermes.shared.model;

public record ChatMessage(
    String messageId,
    String threadId,
    String userId,
    String content
) implements ThreadMessage {

    @Override
    public Channel channel() {
        return Channel.CHAT;
    }

    @Override
    public String sender() {
        return userId;
    }
}
