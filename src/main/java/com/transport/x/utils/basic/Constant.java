package com.transport.x.utils.basic;

public final class Constant {
    private Constant() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static final long UNASSIGNED = -1L;
    public static final long DEFAULT_EDGE_COST = 1L;
    public static final long UNLIMITED_CAPACITY = 1_000_000_000_000L;

    public static final String OUTCOME = "outcome";
    public static final String OUTCOME_COMPLETE = "complete";
    public static final String OUTCOME_PARTIAL = "partial";
    public static final String OUTCOME_INVALID = "invalid";
}
