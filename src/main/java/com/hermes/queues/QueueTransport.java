package com.hermes.queues;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * At-least-once queue primitive. A received message stays invisible for the
 * visibility timeout and is delivered again unless acknowledged.
 */
public interface QueueTransport {

    /** Idempotent. */
    void createQueue(String name);

    /** Idempotent; drops any messages still in the queue. */
    void deleteQueue(String name);

    boolean exists(String name);

    List<String> listQueues(String prefix);

    String send(String queue, String body, Map<String, String> attributes);

    List<QueueMessage> receive(String queue, int maxMessages, Duration visibilityTimeout);

    void acknowledge(String queue, String receiptHandle);

    int depth(String queue);
}
