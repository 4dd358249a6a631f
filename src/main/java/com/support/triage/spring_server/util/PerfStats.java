// PerfStats.java
package com.support.triage.spring_server.util;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-stage timings of one triage run, kept in the order the stages first started.
 */
public class PerfStats {
    private final Instant startTime;
    private final Map<String, Long> stageTimes = new LinkedHashMap<>();
    private final Map<String, Integer> stageCounts = new LinkedHashMap<>();
    private final Map<String, Instant> runningStages = new LinkedHashMap<>();
    private Instant endTime;
    private long totalDuration;

    public PerfStats() {
        this.startTime = Instant.now();
    }

    public synchronized void markStageStart(String stage) {
        runningStages.put(stage, Instant.now());
        stageTimes.putIfAbsent(stage, 0L);
    }

    public synchronized void markStageEnd(String stage) {
        Instant started = runningStages.remove(stage);
        if (started == null) {
            return;
        }
        long duration = Duration.between(started, Instant.now()).toMillis();
        stageTimes.merge(stage, duration, Long::sum);
        stageCounts.merge(stage, 1, Integer::sum);
    }

    public synchronized PerfStats stop() {
        if (endTime == null) {
            // stages still running when the run stops (error paths) are closed here
            for (String stage : runningStages.keySet().toArray(new String[0])) {
                markStageEnd(stage);
            }
            endTime = Instant.now();
            totalDuration = Duration.between(startTime, endTime).toMillis();
        }
        return this;
    }

    public synchronized double elapsedSeconds() {
        Instant end = endTime != null ? endTime : Instant.now();
        return Duration.between(startTime, end).toMillis() / 1000.0;
    }

    public synchronized String toFormattedString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Triage stages (total ").append(totalDuration).append("ms):\n");
        for (Map.Entry<String, Long> entry : stageTimes.entrySet()) {
            sb.append("  ").append(entry.getKey()).append(": ")
                    .append(entry.getValue()).append("ms")
                    .append(" x").append(stageCounts.getOrDefault(entry.getKey(), 0))
                    .append('\n');
        }
        return sb.toString();
    }

    public synchronized Map<String, Long> getStageTimes() {
        return new LinkedHashMap<>(stageTimes);
    }

    public long getTotalDuration() { return totalDuration; }
    public Instant getStartTime() { return startTime; }
    public Instant getEndTime() { return endTime; }
}
