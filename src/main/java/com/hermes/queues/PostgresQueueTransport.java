package com.hermes.queues;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Queues as rows in {@code hermes_queue_messages}. Receivers lock with
 * {@code SKIP LOCKED}, so concurrent consumers never see the same delivery.
 */
public class PostgresQueueTransport implements QueueTransport {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, String>> ATTRIBUTES = new TypeReference<>() {};
    private static final String FOREIGN_KEY_VIOLATION = "23503";

    private final DataSource dataSource;

    public PostgresQueueTransport(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void createQueue(String name) {
        update("INSERT INTO hermes_queues (name) VALUES (?) ON CONFLICT DO NOTHING", name,
                "Failed to create queue " + name);
    }

    @Override
    public void deleteQueue(String name) {
        update("DELETE FROM hermes_queues WHERE name = ?", name, "Failed to delete queue " + name);
    }

    @Override
    public boolean exists(String name) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("SELECT 1 FROM hermes_queues WHERE name = ?")) {
            ps.setString(1, name);
            try (var rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new QueueTransportException("Failed to look up queue " + name, e);
        }
    }

    @Override
    public List<String> listQueues(String prefix) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("SELECT name FROM hermes_queues WHERE name LIKE ? ORDER BY name")) {
            ps.setString(1, prefix.replace("_", "\\_").replace("%", "\\%") + "%");
            try (var rs = ps.executeQuery()) {
                var names = new ArrayList<String>();
                while (rs.next()) names.add(rs.getString(1));
                return names;
            }
        } catch (SQLException e) {
            throw new QueueTransportException("Failed to list queues", e);
        }
    }

    @Override
    public String send(String queue, String body, Map<String, String> attributes) {
        var messageId = UUID.randomUUID().toString();
        var sql = "INSERT INTO hermes_queue_messages (message_id, queue_name, body, attributes) VALUES (?, ?, ?, ?::jsonb)";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, messageId);
            ps.setString(2, queue);
            ps.setString(3, body);
            ps.setString(4, MAPPER.writeValueAsString(attributes));
            ps.executeUpdate();
            return messageId;
        } catch (SQLException e) {
            if (FOREIGN_KEY_VIOLATION.equals(e.getSQLState())) {
                throw new IllegalArgumentException("Unknown queue: " + queue, e);
            }
            throw new QueueTransportException("Failed to send to " + queue, e);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize attributes", e);
        }
    }

    @Override
    public List<QueueMessage> receive(String queue, int maxMessages, Duration visibilityTimeout) {
        var sql = """
            UPDATE hermes_queue_messages
               SET receipt_handle = md5(random()::text || id::text),
                   visible_at = now() + (? * interval '1 millisecond'),
                   receive_count = receive_count + 1
             WHERE id IN (SELECT id FROM hermes_queue_messages
                           WHERE queue_name = ? AND visible_at <= now()
                           ORDER BY id LIMIT ? FOR UPDATE SKIP LOCKED)
            RETURNING message_id, receipt_handle, body, attributes, receive_count
            """;
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setLong(1, visibilityTimeout.toMillis());
            ps.setString(2, queue);
            ps.setInt(3, maxMessages);
            try (var rs = ps.executeQuery()) {
                var messages = new ArrayList<QueueMessage>();
                while (rs.next()) {
                    var attrs = rs.getString("attributes");
                    messages.add(new QueueMessage(
                            rs.getString("message_id"),
                            rs.getString("receipt_handle"),
                            rs.getString("body"),
                            attrs == null ? Map.of() : MAPPER.readValue(attrs, ATTRIBUTES),
                            rs.getInt("receive_count")));
                }
                return messages;
            }
        } catch (SQLException e) {
            throw new QueueTransportException("Failed to receive from " + queue, e);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt attributes in " + queue, e);
        }
    }

    @Override
    public void acknowledge(String queue, String receiptHandle) {
        var sql = "DELETE FROM hermes_queue_messages WHERE queue_name = ? AND receipt_handle = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, queue);
            ps.setString(2, receiptHandle);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new QueueTransportException("Failed to acknowledge on " + queue, e);
        }
    }

    @Override
    public int depth(String queue) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("SELECT count(*) FROM hermes_queue_messages WHERE queue_name = ?")) {
            ps.setString(1, queue);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new QueueTransportException("Failed to count " + queue, e);
        }
    }

    private void update(String sql, String name, String failure) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, name);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new QueueTransportException(failure, e);
        }
    }
}
