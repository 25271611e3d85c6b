package com.chronicle.resolution;

/**
 * How an effect phase ended, derived from its summary counts.
 */
public enum PhaseStatus {
    /** The phase never started because the core action failed. */
    NOT_RUN,
    /** No effect was attempted, or every effect was skipped without error. */
    NO_EFFECTS,
    SUCCEEDED,
    /** Some effects failed and at least one succeeded. */
    COMPLETED_WITH_WARNINGS,
    /** Effects failed and none succeeded. Still non-fatal to the resolution. */
    ALL_FAILED;

    static PhaseStatus of(int succeeded, int failed, int skippedWithError) {
        if (failed == 0 && skippedWithError == 0) return succeeded > 0 ? SUCCEEDED : NO_EFFECTS;
        if (failed == 0) return COMPLETED_WITH_WARNINGS;
        return succeeded > 0 ? COMPLETED_WITH_WARNINGS : ALL_FAILED;
    }
}
