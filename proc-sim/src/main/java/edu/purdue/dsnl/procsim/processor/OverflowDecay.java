package edu.purdue.dsnl.procsim.processor;

/** How requests waiting in a {@link LimitedPsProcessor}'s overflow queue age while they wait. */
public enum OverflowDecay {
    /**
     * Overflowed requests lose the same amount of service as each active request, although they
     * are not being served. Matches the traces produced by earlier runs.
     */
    ACTIVE_SHARE,
    /** Overflowed requests keep their full remaining service until admitted. */
    NONE,
}
