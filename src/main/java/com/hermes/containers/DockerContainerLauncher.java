package com.hermes.containers;

import com.hermes.shared.config.ContainerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/** Starts detached worker containers with {@code docker run -d}. */
public class DockerContainerLauncher implements ContainerLauncher {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerLauncher.class);
    private final ContainerConfig config;

    public DockerContainerLauncher(ContainerConfig config) { this.config = config; }

    @Override
    public String launch() {
        var containerId = "hermes-worker-" + UUID.randomUUID().toString().substring(0, 8);
        var cmd = new ArrayList<String>();
        cmd.add("docker"); cmd.add("run"); cmd.add("-d");
        cmd.add("--name=" + containerId);
        cmd.add("--memory=" + config.memory());
        cmd.add("--cpus=" + config.cpus());
        cmd.add("--pids-limit=" + config.pidsLimit());
        cmd.add("--label"); cmd.add("hermes.managed=true");
        cmd.add("-e"); cmd.add("HERMES_CONTAINER_ID=" + containerId);
        cmd.add(config.image());

        try {
            var proc = new ProcessBuilder(cmd).redirectErrorStream(true).start();
            var stdout = new ByteArrayOutputStream();
            var reader = drain(proc.getInputStream(), stdout);
            if (!proc.waitFor(config.launchTimeoutSeconds(), TimeUnit.SECONDS)) {
                proc.destroyForcibly();
                throw new NoWarmContainerException("docker run timed out after " + config.launchTimeoutSeconds() + "s");
            }
            reader.join(5000);
            if (proc.exitValue() != 0) {
                throw new NoWarmContainerException("docker run failed: " + stdout.toString().trim());
            }
            log.info("Launched worker container {}", containerId);
            return containerId;
        } catch (IOException e) {
            throw new NoWarmContainerException("docker run failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while launching container", e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            var proc = new ProcessBuilder("docker", "info")
                    .redirectErrorStream(true).start();
            var reader = drain(proc.getInputStream(), OutputStream.nullOutputStream());
            var done = proc.waitFor(5, TimeUnit.SECONDS);
            if (!done) proc.destroyForcibly();
            reader.join(2000);
            return done && proc.exitValue() == 0;
        } catch (IOException e) {
            log.debug("Docker not available: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Thread drain(InputStream in, OutputStream out) {
        var thread = new Thread(() -> {
            try {
                in.transferTo(out);
            } catch (IOException e) {
                log.debug("Process output closed: {}", e.getMessage());
            }
        }, "docker-output");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
