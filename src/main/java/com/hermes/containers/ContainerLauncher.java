package com.hermes.containers;

public interface ContainerLauncher {

    /** Starts a worker container and returns its id. */
    String launch();

    boolean isAvailable();
}
