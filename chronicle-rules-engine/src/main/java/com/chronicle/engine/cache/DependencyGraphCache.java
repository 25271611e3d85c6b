package com.chronicle.engine.cache;

import com.chronicle.dependency.graph.GraphBuildResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Built dependency graphs keyed by {@code campaignId:branchId}. A graph is built at most once per key until
 * invalidated; cached results are shared and must be treated as read-only.
 */
public final class DependencyGraphCache {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphCache.class);

    private final Map<String, GraphBuildResult> graphs = new ConcurrentHashMap<>();

    public static String key(String campaignId, String branchId) {
        return Objects.requireNonNull(campaignId, "campaignId") + ":" + Objects.requireNonNull(branchId, "branchId");
    }

    public GraphBuildResult getOrBuild(String campaignId, String branchId, Supplier<GraphBuildResult> builder) {
        String key = key(campaignId, branchId);
        GraphBuildResult cached = graphs.get(key);
        if (cached != null) {
            log.debug("Dependency graph cache hit | key={}", key);
            return cached;
        }
        return graphs.computeIfAbsent(key, k -> {
            log.debug("Dependency graph cache miss | key={}", k);
            return builder.get();
        });
    }

    /** Returns the cached graph, or null. */
    public GraphBuildResult get(String campaignId, String branchId) {
        return graphs.get(key(campaignId, branchId));
    }

    public boolean invalidate(String campaignId, String branchId) {
        boolean removed = graphs.remove(key(campaignId, branchId)) != null;
        if (removed) log.info("Dependency graph invalidated | campaignId={} | branchId={}", campaignId, branchId);
        return removed;
    }

    /** Drops every branch of the campaign. Returns the number of graphs removed. */
    public int invalidateCampaign(String campaignId) {
        String prefix = Objects.requireNonNull(campaignId, "campaignId") + ":";
        int before = graphs.size();
        graphs.keySet().removeIf(k -> k.startsWith(prefix));
        int removed = before - graphs.size();
        log.info("Dependency graphs invalidated | campaignId={} | removed={}", campaignId, removed);
        return removed;
    }

    public void clear() {
        graphs.clear();
    }

    public int size() {
        return graphs.size();
    }
}
