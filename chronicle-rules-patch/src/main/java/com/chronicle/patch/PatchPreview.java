package com.chronicle.patch;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * What a payload would do to a document, computed without touching the caller's copy.
 * {@code after} is null when the payload would fail; {@code changedFields} lists top-level fields whose value changes.
 */
public record PatchPreview(boolean success, ObjectNode before, ObjectNode after, List<String> changedFields, List<String> errors) {

    public PatchPreview {
        changedFields = changedFields != null ? List.copyOf(changedFields) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
