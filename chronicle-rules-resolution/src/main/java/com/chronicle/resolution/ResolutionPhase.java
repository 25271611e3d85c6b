package com.chronicle.resolution;

import com.chronicle.model.EffectTiming;

/**
 * Steps of one resolution, in order. The three effect phases map onto {@link EffectTiming};
 * {@link #ACTION} is the caller-owned core action between PRE and ON_RESOLVE.
 */
public enum ResolutionPhase {
    PRE(EffectTiming.PRE, "pre"),
    ACTION(null, "action"),
    ON_RESOLVE(EffectTiming.ON_RESOLVE, "onResolve"),
    POST(EffectTiming.POST, "post");

    private final EffectTiming timing;
    private final String key;

    ResolutionPhase(EffectTiming timing, String key) {
        this.timing = timing;
        this.key = key;
    }

    /** Effect timing run in this phase, or null for {@link #ACTION}. */
    public EffectTiming timing() {
        return timing;
    }

    /** Key used for the phase in result documents and metric tags. */
    public String key() {
        return key;
    }

    public static ResolutionPhase of(EffectTiming timing) {
        return switch (timing) {
            case PRE -> PRE;
            case ON_RESOLVE -> ON_RESOLVE;
            case POST -> POST;
        };
    }
}
