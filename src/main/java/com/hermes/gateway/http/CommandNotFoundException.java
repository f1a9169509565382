package com.hermes.gateway.http;

public class CommandNotFoundException extends RuntimeException {

    public CommandNotFoundException(String commandId) {
        super("Unknown command: " + commandId);
    }
}
