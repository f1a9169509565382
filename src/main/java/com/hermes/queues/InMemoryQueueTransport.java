package com.hermes.queues;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryQueueTransport implements QueueTransport {

    private final Map<String, MemoryQueue> queues = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryQueueTransport(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void createQueue(String name) {
        queues.computeIfAbsent(name, n -> new MemoryQueue());
    }

    @Override
    public void deleteQueue(String name) {
        queues.remove(name);
    }

    @Override
    public boolean exists(String name) {
        return queues.containsKey(name);
    }

    @Override
    public List<String> listQueues(String prefix) {
        return queues.keySet().stream()
                .filter(name -> name.startsWith(prefix))
                .sorted()
                .toList();
    }

    @Override
    public String send(String queue, String body, Map<String, String> attributes) {
        var q = require(queue);
        var entry = new Entry(UUID.randomUUID().toString(), body, Map.copyOf(attributes), Instant.MIN);
        synchronized (q) {
            q.entries.add(entry);
        }
        return entry.messageId;
    }

    @Override
    public List<QueueMessage> receive(String queue, int maxMessages, Duration visibilityTimeout) {
        var q = require(queue);
        var now = clock.instant();
        var received = new ArrayList<QueueMessage>();
        synchronized (q) {
            for (var entry : q.entries) {
                if (received.size() >= maxMessages) break;
                if (entry.visibleAt.isAfter(now)) continue;
                entry.visibleAt = now.plus(visibilityTimeout);
                entry.receiveCount++;
                entry.receiptHandle = UUID.randomUUID().toString();
                received.add(new QueueMessage(entry.messageId, entry.receiptHandle, entry.body,
                        entry.attributes, entry.receiveCount));
            }
        }
        return received;
    }

    @Override
    public void acknowledge(String queue, String receiptHandle) {
        var q = require(queue);
        synchronized (q) {
            q.entries.removeIf(e -> receiptHandle.equals(e.receiptHandle));
        }
    }

    @Override
    public int depth(String queue) {
        var q = require(queue);
        synchronized (q) {
            return q.entries.size();
        }
    }

    private MemoryQueue require(String name) {
        var q = queues.get(name);
        if (q == null) throw new IllegalArgumentException("Unknown queue: " + name);
        return q;
    }

    private static final class MemoryQueue {
        private final List<Entry> entries = new ArrayList<>();
    }

    private static final class Entry {
        private final String messageId;
        private final String body;
        private final Map<String, String> attributes;
        private Instant visibleAt;
        private String receiptHandle;
        private int receiveCount;

        private Entry(String messageId, String body, Map<String, String> attributes, Instant visibleAt) {
            this.messageId = messageId;
            this.body = body;
            this.attributes = attributes;
            this.visibleAt = visibleAt;
        }
    }
}
