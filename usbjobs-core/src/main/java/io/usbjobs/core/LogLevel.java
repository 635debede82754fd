package io.usbjobs.core;

public enum LogLevel {
    DEBUG("debug"),
    INFO("info"),
    WARNING("warning"),
    ERROR("error");

    private final String value;

    LogLevel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
