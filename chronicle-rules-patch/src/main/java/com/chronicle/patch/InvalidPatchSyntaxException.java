package com.chronicle.patch;

/**
 * Thrown when a payload fails validation, before any operation is applied.
 */
public final class InvalidPatchSyntaxException extends PatchException {

    private final ValidationResult validation;

    public InvalidPatchSyntaxException(ValidationResult validation) {
        super("Invalid patch: " + String.join("; ", validation.getErrors()));
        this.validation = validation;
    }

    public ValidationResult getValidation() {
        return validation;
    }

    @Override
    public String getErrorType() {
        return "InvalidPatchSyntax";
    }
}
