package com.chronicle.patch;

/**
 * Thrown when an operation references a location that does not exist (the target of remove/replace,
 * the source of move/copy, or the parent container of add).
 */
public final class PathNotFoundException extends PatchException {

    private final int opIndex;
    private final String pointer;

    public PathNotFoundException(int opIndex, String pointer) {
        super(String.format("Path not found at operation %d: %s", opIndex, pointer));
        this.opIndex = opIndex;
        this.pointer = pointer;
    }

    public int getOpIndex() {
        return opIndex;
    }

    public String getPointer() {
        return pointer;
    }

    @Override
    public String getErrorType() {
        return "PathNotFound";
    }
}
