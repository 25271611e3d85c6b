/**
 * Patch engine for entity variable state: RFC-6902-shaped add/remove/replace/move/copy/test payloads,
 * validated by {@link com.chronicle.patch.PatchValidator} and applied atomically by
 * {@link com.chronicle.patch.PatchEngine}, with a {@link com.chronicle.patch.VariableDiff} per application.
 */
package com.chronicle.patch;
