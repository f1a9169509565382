package com.hermes.shared.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        var cfg = ConfigLoader.load(tempDir.resolve("absent.yaml"));

        assertEquals(ClaimConfig.defaults(), cfg.claims());
        assertEquals(ContainerConfig.defaults(), cfg.containers());
        assertEquals("default", cfg.routing().fallback().projectId());
        assertTrue(cfg.routing().routes().isEmpty());
    }

    @Test
    void emptyFileGivesDefaults() throws IOException {
        var cfg = writeAndLoad("");

        assertEquals(QueueConfig.defaults(), cfg.queues());
    }

    @Test
    void parsesFullConfig() throws IOException {
        var yaml = """
            queues:
              prefix: webordinary
              visibility-timeout: 120
              response-batch-size: 5
            claims:
              idle-after: 60
              reclaim-after: 600
              sweep-interval: 10
            containers:
              launcher: docker
              image: worker:2
              warm-pool-size: 4
            routing:
              routes:
                - sender: jane@acme.com
                  client: acme
                  project: siteA
                  user: jane
              fallback:
                client: ops
                project: triage
                user: nobody
            """;
        var cfg = writeAndLoad(yaml);

        assertEquals("webordinary", cfg.queues().prefix());
        assertEquals(120, cfg.queues().visibilityTimeoutSeconds());
        assertEquals(5, cfg.queues().responseBatchSize());
        assertEquals(Duration.ofMinutes(1), cfg.claims().idleAfter());
        assertEquals(Duration.ofMinutes(10), cfg.claims().reclaimAfter());
        assertEquals(Duration.ofSeconds(10), cfg.claims().sweepInterval());
        assertEquals("docker", cfg.containers().launcher());
        assertEquals("worker:2", cfg.containers().image());
        assertEquals(4, cfg.containers().warmPoolSize());
        assertEquals("2g", cfg.containers().memory());
        assertEquals(1, cfg.routing().routes().size());
        assertEquals("siteA", cfg.routing().routes().get(0).projectId());
        assertEquals("triage", cfg.routing().fallback().projectId());
    }

    @Test
    void reclaimMustOutlastIdle() {
        assertThrows(IllegalArgumentException.class, () -> writeAndLoad("""
            claims:
              idle-after: 600
              reclaim-after: 300
            """));
    }

    private HermesConfig writeAndLoad(String yaml) throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return ConfigLoader.load(file);
    }
}
