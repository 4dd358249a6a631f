// PerfTracker.java
package com.support.triage.spring_server.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-bound stage timer for the triage pipeline. A run is opened with {@link #start()},
 * stages are bracketed with {@link #in(String)} / {@link #out(String)}, and the run must be
 * closed with {@link #stopAndClean()} on the same thread.
 */
public class PerfTracker {
    private static final Logger LOGGER = LoggerFactory.getLogger(PerfTracker.class);
    private static final ThreadLocal<PerfStats> CURRENT = new ThreadLocal<>();

    private PerfTracker() {
    }

    public static PerfStats start() {
        PerfStats perfStats = new PerfStats();
        CURRENT.set(perfStats);
        return perfStats;
    }

    public static void in(String stage) {
        PerfStats perfStats = CURRENT.get();
        if (perfStats == null) {
            LOGGER.warn("PerfTracker not started, ignoring stage {}", stage);
            return;
        }
        perfStats.markStageStart(stage);
    }

    public static void out(String stage) {
        PerfStats perfStats = CURRENT.get();
        if (perfStats != null) {
            perfStats.markStageEnd(stage);
        }
    }

    public static PerfStats current() {
        return CURRENT.get();
    }

    public static PerfStats stopAndClean() {
        PerfStats perfStats = CURRENT.get();
        if (perfStats != null) {
            perfStats.stop();
            CURRENT.remove();
        }
        return perfStats;
    }
}
