package io.usbjobs.execution;

public enum VerificationStrategy {
    /**
     * Re-stat every copied file.
     */
    FULL,
    /**
     * Re-stat a random subset sized by percentage with a floor.
     */
    SAMPLING
}
