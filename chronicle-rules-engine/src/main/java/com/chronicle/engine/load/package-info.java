/**
 * Read-only sources of campaign rules: in memory, or snapshot files on disk.
 */
package com.chronicle.engine.load;
