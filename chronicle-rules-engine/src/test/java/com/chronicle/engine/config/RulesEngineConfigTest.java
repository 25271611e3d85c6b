package com.chronicle.engine.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RulesEngineConfigTest {

    @Test
    void emptyEnvironmentUsesDefaults() {
        RulesEngineConfig config = RulesEngineConfig.fromMap(Map.of());

        assertEquals("main", config.getDefaultBranch());
        assertEquals(32, config.getMaxExpressionDepth());
        assertTrue(config.isIncludeTrace());
        assertTrue(config.isGraphCacheEnabled());
        assertFalse(config.isRefuseCyclicEffects());
        assertEquals("snapshots", config.getSnapshotDir());
    }

    @Test
    void readsEveryKey() {
        RulesEngineConfig config = RulesEngineConfig.fromMap(Map.of(
                RulesEngineConfig.ENV_DEFAULT_BRANCH, " draft ",
                RulesEngineConfig.ENV_MAX_EXPRESSION_DEPTH, "8",
                RulesEngineConfig.ENV_INCLUDE_TRACE, "false",
                RulesEngineConfig.ENV_GRAPH_CACHE_ENABLED, "0",
                RulesEngineConfig.ENV_REFUSE_CYCLIC_EFFECTS, "TRUE",
                RulesEngineConfig.ENV_SNAPSHOT_DIR, "/data/campaigns"));

        assertEquals("draft", config.getDefaultBranch());
        assertEquals(8, config.getMaxExpressionDepth());
        assertFalse(config.isIncludeTrace());
        assertFalse(config.isGraphCacheEnabled());
        assertTrue(config.isRefuseCyclicEffects());
        assertEquals("/data/campaigns", config.getSnapshotDir());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        RulesEngineConfig config = RulesEngineConfig.fromMap(Map.of(
                RulesEngineConfig.ENV_MAX_EXPRESSION_DEPTH, "deep",
                RulesEngineConfig.ENV_INCLUDE_TRACE, "maybe",
                RulesEngineConfig.ENV_GRAPH_CACHE_ENABLED, "  "));

        assertEquals(RulesEngineConfig.DEFAULT_MAX_EXPRESSION_DEPTH, config.getMaxExpressionDepth());
        assertTrue(config.isIncludeTrace());
        assertTrue(config.isGraphCacheEnabled());
    }

    @Test
    void nonPositiveDepthFromEnvironmentFallsBack() {
        RulesEngineConfig config = RulesEngineConfig.fromMap(Map.of(RulesEngineConfig.ENV_MAX_EXPRESSION_DEPTH, "-3"));
        assertEquals(RulesEngineConfig.DEFAULT_MAX_EXPRESSION_DEPTH, config.getMaxExpressionDepth());
    }

    @Test
    void builderRejectsNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> RulesEngineConfig.builder().maxExpressionDepth(0));
    }

    @Test
    void blankBranchResolvesToDefault() {
        RulesEngineConfig config = RulesEngineConfig.builder().defaultBranch("trunk").build();

        assertEquals("trunk", config.branchOrDefault(null));
        assertEquals("trunk", config.branchOrDefault(" "));
        assertEquals("b-2", config.branchOrDefault("b-2"));
    }
}
