/**
 * Engine facade: {@link com.chronicle.engine.RulesEngine} wires the evaluator, patch engine, graph builder and
 * resolution pipeline over a {@link com.chronicle.engine.load.RulesSource}.
 */
package com.chronicle.engine;
