package com.hermes.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One namespace of the {@code hermes_records} table. Payloads are JSON; the
 * version column carries the compare-and-set and is drawn from the
 * {@code hermes_record_versions} sequence shared by all records.
 */
public class PostgresVersionedStore<T> implements VersionedStore<T> {

    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();

    private final DataSource dataSource;
    private final String namespace;
    private final Class<T> type;

    public PostgresVersionedStore(DataSource dataSource, String namespace, Class<T> type) {
        this.dataSource = dataSource;
        this.namespace = namespace;
        this.type = type;
    }

    @Override
    public Optional<Versioned<T>> get(String key) {
        var sql = "SELECT record_key, version, payload FROM hermes_records WHERE namespace = ? AND record_key = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setString(2, key);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read " + namespace + "/" + key, e);
        }
    }

    @Override
    public boolean putIfAbsent(String key, T value) {
        var sql = "INSERT INTO hermes_records (namespace, record_key, version, payload, updated_at) "
                + "VALUES (?, ?, nextval('hermes_record_versions'), ?::jsonb, now()) ON CONFLICT (namespace, record_key) DO NOTHING";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setString(2, key);
            ps.setString(3, write(value));
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to create " + namespace + "/" + key, e);
        }
    }

    @Override
    public boolean replace(String key, long expectedVersion, T value) {
        var sql = "UPDATE hermes_records SET payload = ?::jsonb, version = nextval('hermes_record_versions'), updated_at = now() "
                + "WHERE namespace = ? AND record_key = ? AND version = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, write(value));
            ps.setString(2, namespace);
            ps.setString(3, key);
            ps.setLong(4, expectedVersion);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to update " + namespace + "/" + key, e);
        }
    }

    @Override
    public boolean delete(String key, long expectedVersion) {
        var sql = "DELETE FROM hermes_records WHERE namespace = ? AND record_key = ? AND version = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setString(2, key);
            ps.setLong(3, expectedVersion);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to delete " + namespace + "/" + key, e);
        }
    }

    @Override
    public List<Versioned<T>> scan() {
        var sql = "SELECT record_key, version, payload FROM hermes_records WHERE namespace = ? ORDER BY record_key";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, namespace);
            try (var rs = ps.executeQuery()) {
                var records = new ArrayList<Versioned<T>>();
                while (rs.next()) {
                    records.add(read(rs));
                }
                return records;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to scan " + namespace, e);
        }
    }

    private Versioned<T> read(ResultSet rs) throws SQLException {
        var key = rs.getString("record_key");
        try {
            return new Versioned<>(key, MAPPER.readValue(rs.getString("payload"), type), rs.getLong("version"));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt record " + namespace + "/" + key, e);
        }
    }

    private String write(T value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + type.getSimpleName(), e);
        }
    }
}
