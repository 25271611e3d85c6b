package com.chronicle.patch;

import com.chronicle.model.EntitySnapshot;
import com.chronicle.model.VariableState;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Outcome of a successfully applied payload: the patched document, its variables and the diff against the input.
 */
public record PatchResult(ObjectNode document, VariableDiff diff, List<String> warnings) {

    public PatchResult {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public VariableState variables() {
        return VariableState.of(document.get(EntitySnapshot.VARIABLES_FIELD));
    }
}
