/**
 * Read and write dependencies of conditions and effects, and the dependency graph built from them
 * ({@link com.chronicle.dependency.graph}).
 */
package com.chronicle.dependency;
