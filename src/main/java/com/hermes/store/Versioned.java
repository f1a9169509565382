package com.hermes.store;

public record Versioned<T>(String key, T value, long version) {}
