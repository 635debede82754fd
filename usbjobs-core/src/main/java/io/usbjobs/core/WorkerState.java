package io.usbjobs.core;

/**
 * STOPPED -> RUNNING -> STOPPING -> STOPPED. Polling and timers are only active while RUNNING.
 */
public enum WorkerState {
    STOPPED,
    RUNNING,
    STOPPING
}
