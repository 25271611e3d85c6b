/**
 * Phased effect resolution for encounters and events.
 *
 * <p>{@link com.chronicle.resolution.EffectResolutionPipeline} runs PRE effects, the caller's
 * {@link com.chronicle.resolution.ResolutionAction}, then ON_RESOLVE and POST effects, producing a
 * {@link com.chronicle.resolution.ResolutionResult} with one
 * {@link com.chronicle.resolution.EffectExecutionSummary} per phase.
 */
package com.chronicle.resolution;
