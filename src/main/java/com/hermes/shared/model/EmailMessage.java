package com.hermes.shared.model;

import java.util.List;

public record EmailMessage(
    String messageId,
    String inReplyTo,
    List<String> references,
    String from,
    String subject,
    String body
) implements ThreadMessage {

    public EmailMessage {
        references = references == null ? List.of() : List.copyOf(references);
    }

    @Override
    public Channel channel() {
        return Channel.EMAIL;
    }

    @Override
    public String sender() {
        return from;
    }
}
