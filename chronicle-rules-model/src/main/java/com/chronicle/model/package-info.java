/**
 * Records consumed by the rules engine.
 *
 * <ul>
 *   <li>{@link com.chronicle.model.Condition} and {@link com.chronicle.model.Effect}: persisted rules, read-only here</li>
 *   <li>{@link com.chronicle.model.PatchOp}: one RFC-6902-shaped instruction of an effect payload</li>
 *   <li>{@link com.chronicle.model.VariableState} and {@link com.chronicle.model.EntitySnapshot}: entity state</li>
 *   <li>{@link com.chronicle.model.RulesJson}: {@code fromJson}/{@code toJson} helpers</li>
 * </ul>
 */
package com.chronicle.model;
