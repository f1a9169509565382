package com.hermes.shared.model;

public record SmsMessage(
    String from,
    String to,
    String messageId,
    String conversationId,
    String body
) implements ThreadMessage {

    @Override
    public Channel channel() {
        return Channel.SMS;
    }

    @Override
    public String sender() {
        return from;
    }
}
