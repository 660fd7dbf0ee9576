package com.bridgestats.stats.engine;

/**
 * One independently scheduled unit of work: an aggregation pass or the reserve check.
 * {@link #run()} may throw; the engine logs the failure and runs the pass again on the next tick.
 */
public interface ScheduledPass {

    /** Stable name, also the key of the pass interval in configuration. */
    String name();

    void run();
}
