package com.support.triage.spring_server.dto;

import lombok.Data;

@Data
public class CacheStats {
    private final boolean redisEnabled;
    private final int localEntries;
    private final long hits;
    private final long misses;
    private final long redisFailures;

    public CacheStats(boolean redisEnabled, int localEntries, long hits, long misses, long redisFailures) {
        this.redisEnabled = redisEnabled;
        this.localEntries = localEntries;
        this.hits = hits;
        this.misses = misses;
        this.redisFailures = redisFailures;
    }
}
