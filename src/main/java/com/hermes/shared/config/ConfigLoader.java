package com.hermes.shared.config;

import com.hermes.shared.model.ProjectRoute;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".hermes", "config.yaml"
    );

    public static HermesConfig load() {
        return load(DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static HermesConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var db = (Map<String, Object>) raw.getOrDefault("database", Map.of());
        var queues = (Map<String, Object>) raw.getOrDefault("queues", Map.of());
        var claims = (Map<String, Object>) raw.getOrDefault("claims", Map.of());
        var containers = (Map<String, Object>) raw.getOrDefault("containers", Map.of());
        var routing = (Map<String, Object>) raw.getOrDefault("routing", Map.of());

        return new HermesConfig(
            Integer.parseInt(envOrDefault("HERMES_PORT",
                String.valueOf(server.getOrDefault("port", 8080)))),
            envOrDefault("HERMES_STORE", String.valueOf(raw.getOrDefault("store", "memory"))),
            Map.of(
                "url", envOrDefault("HERMES_DB_URL",
                    (String) db.getOrDefault("url", "jdbc:postgresql://localhost:5432/hermes")),
                "username", envOrDefault("HERMES_DB_USER",
                    (String) db.getOrDefault("username", "hermes")),
                "password", envOrDefault("HERMES_DB_PASS",
                    (String) db.getOrDefault("password", "hermes"))
            ),
            parseQueueConfig(queues),
            parseClaimConfig(claims),
            parseContainerConfig(containers),
            parseRoutingConfig(routing)
        );
    }

    private static QueueConfig parseQueueConfig(Map<String, Object> queues) {
        var defaults = QueueConfig.defaults();
        return new QueueConfig(
            String.valueOf(queues.getOrDefault("prefix", defaults.prefix())),
            Integer.parseInt(String.valueOf(queues.getOrDefault("visibility-timeout", defaults.visibilityTimeoutSeconds()))),
            Integer.parseInt(String.valueOf(queues.getOrDefault("response-batch-size", defaults.responseBatchSize())))
        );
    }

    private static ClaimConfig parseClaimConfig(Map<String, Object> claims) {
        var defaults = ClaimConfig.defaults();
        return new ClaimConfig(
            seconds(claims, "idle-after", defaults.idleAfter()),
            seconds(claims, "reclaim-after", defaults.reclaimAfter()),
            seconds(claims, "sweep-interval", defaults.sweepInterval())
        );
    }

    private static ContainerConfig parseContainerConfig(Map<String, Object> containers) {
        var defaults = ContainerConfig.defaults();
        return new ContainerConfig(
            String.valueOf(containers.getOrDefault("launcher", defaults.launcher())),
            String.valueOf(containers.getOrDefault("image", defaults.image())),
            String.valueOf(containers.getOrDefault("memory", defaults.memory())),
            String.valueOf(containers.getOrDefault("cpus", defaults.cpus())),
            Integer.parseInt(String.valueOf(containers.getOrDefault("pids-limit", defaults.pidsLimit()))),
            Integer.parseInt(String.valueOf(containers.getOrDefault("warm-pool-size", defaults.warmPoolSize()))),
            Long.parseLong(String.valueOf(containers.getOrDefault("launch-timeout", defaults.launchTimeoutSeconds())))
        );
    }

    @SuppressWarnings("unchecked")
    private static RoutingConfig parseRoutingConfig(Map<String, Object> routing) {
        var defaults = RoutingConfig.defaults();
        var routes = ((List<Map<String, Object>>) routing.getOrDefault("routes", List.of())).stream()
                .map(ConfigLoader::parseRoute)
                .toList();
        var fallback = routing.containsKey("fallback")
                ? parseRoute((Map<String, Object>) routing.get("fallback"))
                : defaults.fallback();
        return new RoutingConfig(routes, fallback);
    }

    private static ProjectRoute parseRoute(Map<String, Object> route) {
        return new ProjectRoute(
            route.containsKey("sender") ? String.valueOf(route.get("sender")) : null,
            String.valueOf(route.getOrDefault("client", "default")),
            String.valueOf(route.getOrDefault("project", "default")),
            String.valueOf(route.getOrDefault("user", "unknown"))
        );
    }

    // durations are configured in seconds
    private static Duration seconds(Map<String, Object> section, String key, Duration fallback) {
        if (!section.containsKey(key)) return fallback;
        return Duration.ofSeconds(Long.parseLong(String.valueOf(section.get(key))));
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
