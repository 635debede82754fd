package io.usbjobs.execution;

/**
 * Outcome of the verify stage. Files left out by sampling count as skipped, not failed.
 */
public record VerificationResult(
        int verified,
        int failed,
        int skipped
) {

    public boolean passed() {
        return failed == 0;
    }
}
