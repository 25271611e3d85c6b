package com.chronicle.patch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of patch payload validation. Errors make the payload unusable; warnings are informational
 * (a path outside {@code /variables/}, unknown extra fields) and do not block application.
 */
public final class ValidationResult {

    private final boolean valid;
    private final List<String> errors;
    private final List<String> warnings;

    private ValidationResult(boolean valid, List<String> errors, List<String> warnings) {
        this.valid = valid;
        this.errors = errors != null ? Collections.unmodifiableList(new ArrayList<>(errors)) : List.of();
        this.warnings = warnings != null ? Collections.unmodifiableList(new ArrayList<>(warnings)) : List.of();
    }

    public static ValidationResult success() {
        return new ValidationResult(true, List.of(), List.of());
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors == null || errors.isEmpty(), errors, warnings);
    }

    public static ValidationResult failure(String singleError) {
        return new ValidationResult(false, List.of(Objects.requireNonNull(singleError, "singleError")), List.of());
    }

    public boolean isValid() {
        return valid;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return valid ? "valid" + (warnings.isEmpty() ? "" : " " + warnings) : "invalid " + errors;
    }
}
