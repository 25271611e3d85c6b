package com.chronicle.patch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Thrown when a {@code test} operation finds a value different from the expected one.
 */
public final class PatchTestFailedException extends PatchException {

    private final int opIndex;
    private final String path;
    private final String expected;
    private final String actual;

    public PatchTestFailedException(int opIndex, String path, JsonNode expected, JsonNode actual) {
        super(String.format("Test failed at operation %d: path=%s expected=%s actual=%s",
                opIndex, path, expected, actual != null ? actual : "<missing>"));
        this.opIndex = opIndex;
        this.path = path;
        this.expected = String.valueOf(expected);
        this.actual = actual != null ? actual.toString() : null;
    }

    public int getOpIndex() {
        return opIndex;
    }

    public String getPath() {
        return path;
    }

    public String getExpected() {
        return expected;
    }

    /** JSON text of the value found, or null when the path did not exist. */
    public String getActual() {
        return actual;
    }

    @Override
    public String getErrorType() {
        return "PatchTestFailed";
    }
}
