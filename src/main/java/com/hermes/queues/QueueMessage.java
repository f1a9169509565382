package com.hermes.queues;

import java.util.Map;

public record QueueMessage(
    String messageId,
    String receiptHandle,
    String body,
    Map<String, String> attributes,
    int receiveCount
) {}
