package com.chronicle.patch;

/**
 * Base class of patch failures. Any failure leaves the target state untouched.
 */
public abstract class PatchException extends RuntimeException {

    protected PatchException(String message) {
        super(message);
    }

    /** Short error category for summaries and logs, e.g. {@code PatchTestFailed}. */
    public abstract String getErrorType();
}
