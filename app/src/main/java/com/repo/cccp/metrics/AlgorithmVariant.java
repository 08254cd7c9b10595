package com.repo.cccp.metrics;

import java.util.Locale;

/**
 * Rule sets for computing plan depth and plan index.
 * <p>
 * The analysis went through several revisions that disagree on a few details.
 * {@link #CANONICAL} is the default; the others reproduce earlier behavior so
 * results can be compared against historical runs.
 */
public enum AlgorithmVariant {

    CANONICAL(true, 1, true),

    /** Counts every assignment target identifier, including write-only ones. */
    TARGETS_COUNTED(false, 1, true),

    /** Earliest rules: targets counted, empty containers free, subscripts never compound. */
    LEGACY(false, 0, false);

    private final boolean excludeStoreTargets;
    private final int emptyContainerDepth;
    private final boolean compoundChainedSubscripts;

    AlgorithmVariant(boolean excludeStoreTargets, int emptyContainerDepth, boolean compoundChainedSubscripts) {
        this.excludeStoreTargets = excludeStoreTargets;
        this.emptyContainerDepth = emptyContainerDepth;
        this.compoundChainedSubscripts = compoundChainedSubscripts;
    }

    /**
     * Whether identifiers that are only written by an assignment are left out of
     * the plan index.
     */
    public boolean excludeStoreTargets() {
        return excludeStoreTargets;
    }

    /** Depth of an empty list or tuple display. */
    public int emptyContainerDepth() {
        return emptyContainerDepth;
    }

    /**
     * Whether {@code m[i][j]} adds the depths of successive indexes instead of
     * taking their maximum.
     */
    public boolean compoundChainedSubscripts() {
        return compoundChainedSubscripts;
    }

    /**
     * Parse a variant name as written in configuration, case-insensitive.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static AlgorithmVariant fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown algorithm variant: " + name
                    + " (expected canonical, targets_counted or legacy)", e);
        }
    }
}
