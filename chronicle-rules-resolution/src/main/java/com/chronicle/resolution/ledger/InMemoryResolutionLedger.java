package com.chronicle.resolution.ledger;

import com.chronicle.model.EntityRef;
import com.chronicle.resolution.EffectExecutionResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ledger that keeps every record in memory, for tests and for callers that inspect a resolution afterwards.
 * Thread-safe; records of one resolution are expected to come from a single thread.
 */
public final class InMemoryResolutionLedger implements ResolutionLedger {

    /** Everything recorded for one resolution. */
    public static final class Entry {
        private final String resolutionId;
        private final EntityRef entity;
        private final int effectCount;
        private final long startTimeMillis;
        private final List<EffectExecutionResult> effects = Collections.synchronizedList(new ArrayList<>());
        private volatile boolean ended;
        private volatile boolean resolved;
        private volatile String errorMessage;
        private volatile Long durationMs;

        Entry(String resolutionId, EntityRef entity, int effectCount, long startTimeMillis) {
            this.resolutionId = resolutionId;
            this.entity = entity;
            this.effectCount = effectCount;
            this.startTimeMillis = startTimeMillis;
        }

        public String getResolutionId() {
            return resolutionId;
        }

        public EntityRef getEntity() {
            return entity;
        }

        public int getEffectCount() {
            return effectCount;
        }

        public long getStartTimeMillis() {
            return startTimeMillis;
        }

        public List<EffectExecutionResult> getEffects() {
            synchronized (effects) {
                return List.copyOf(effects);
            }
        }

        public boolean isEnded() {
            return ended;
        }

        public boolean isResolved() {
            return resolved;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public Long getDurationMs() {
            return durationMs;
        }
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final List<String> order = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void resolutionStarted(String resolutionId, EntityRef entity, int effectCount, long startTimeMillis) {
        if (entries.putIfAbsent(resolutionId, new Entry(resolutionId, entity, effectCount, startTimeMillis)) == null) {
            order.add(resolutionId);
        }
    }

    @Override
    public void effectExecuted(String resolutionId, EffectExecutionResult result, long timeMillis) {
        entry(resolutionId).effects.add(result);
    }

    @Override
    public void resolutionEnded(String resolutionId, boolean resolved, String errorMessage, long endTimeMillis) {
        resolutionEnded(resolutionId, resolved, errorMessage, endTimeMillis, null);
    }

    @Override
    public void resolutionEnded(String resolutionId, boolean resolved, String errorMessage, long endTimeMillis, Long durationMs) {
        Entry e = entry(resolutionId);
        e.resolved = resolved;
        e.errorMessage = errorMessage;
        e.durationMs = durationMs != null ? durationMs : endTimeMillis - e.startTimeMillis;
        e.ended = true;
    }

    /** Returns the entry, or null if the resolution was never started. */
    public Entry get(String resolutionId) {
        return resolutionId != null ? entries.get(resolutionId) : null;
    }

    /** Entries in start order. */
    public List<Entry> entries() {
        List<Entry> out = new ArrayList<>();
        synchronized (order) {
            for (String id : order) out.add(entries.get(id));
        }
        return Collections.unmodifiableList(out);
    }

    public int size() {
        return entries.size();
    }

    private Entry entry(String resolutionId) {
        Entry e = entries.get(resolutionId);
        if (e == null) throw new IllegalStateException("Resolution not started: " + resolutionId);
        return e;
    }
}
