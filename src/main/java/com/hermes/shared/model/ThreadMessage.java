package com.hermes.shared.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A message as received from one inbound channel, carrying only that channel's
 * correlation fields. The {@link #channel()} tag drives per-channel handling.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "channel")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EmailMessage.class, name = "email"),
    @JsonSubTypes.Type(value = SmsMessage.class, name = "sms"),
    @JsonSubTypes.Type(value = ChatMessage.class, name = "chat")
})
public sealed interface ThreadMessage permits EmailMessage, SmsMessage, ChatMessage {

    Channel channel();

    /** Channel-native sender address: email address, phone number or chat user id. */
    String sender();
}
