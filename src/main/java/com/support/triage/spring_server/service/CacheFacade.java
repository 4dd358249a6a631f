package com.support.triage.spring_server.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.support.triage.spring_server.dto.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Memoizes triage results in Redis with a per-kind TTL.
 * <p>
 * When Redis is disabled or a Redis call fails, the same operation is served from a
 * size-bounded Caffeine cache per kind that honours the same TTLs. A failed or corrupt read
 * is a miss.
 * Writes overwrite per key, so concurrent callers need no locking.
 */
@Service
public class CacheFacade {
    private static final Logger log = LoggerFactory.getLogger(CacheFacade.class);

    static final long DEFAULT_LOCAL_MAX_SIZE = 10_000;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final boolean redisEnabled;

    private final Map<CacheKind, Cache<String, String>> localCaches = new EnumMap<>(CacheKind.class);
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong redisFailures = new AtomicLong();

    public CacheFacade(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Clock clock, boolean redisEnabled) {
        this(redisTemplate, objectMapper, clock, redisEnabled, DEFAULT_LOCAL_MAX_SIZE);
    }

    @Autowired
    public CacheFacade(StringRedisTemplate redisTemplate,
                       ObjectMapper objectMapper,
                       Clock clock,
                       @Value("${cache.redis.enabled:true}") boolean redisEnabled,
                       @Value("${cache.local.max-size:10000}") long localMaxSize) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.redisEnabled = redisEnabled;
        for (CacheKind kind : CacheKind.values()) {
            localCaches.put(kind, Caffeine.newBuilder()
                    .maximumSize(localMaxSize)
                    .expireAfterWrite(kind.getTtl())
                    .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                    .build());
        }
        if (!redisEnabled) {
            log.warn("Redis cache disabled, using in-memory cache");
        }
    }

    public <T> Optional<T> get(CacheKind kind, String identity, Class<T> type) {
        return read(kind, kind.key(identity), objectMapper.constructType(type));
    }

    public <T> Optional<T> get(CacheKind kind, String identity, TypeReference<T> type) {
        return read(kind, kind.key(identity), objectMapper.constructType(type));
    }

    public boolean set(CacheKind kind, String identity, Object value) {
        String key = kind.key(identity);
        String payload;
        try {
            payload = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Cache set failed for key {}: cannot serialise {}", key, value.getClass().getSimpleName(), e);
            return false;
        }

        if (redisEnabled) {
            try {
                redisTemplate.opsForValue().set(key, payload, kind.getTtl());
                return true;
            } catch (RuntimeException e) {
                redisFailures.incrementAndGet();
                log.warn("Redis set failed for key {}, caching locally: {}", key, e.getMessage());
            }
        }
        localCaches.get(kind).put(key, payload);
        return true;
    }

    public <T> T getOrCompute(CacheKind kind, String identity, Class<T> type, Supplier<T> loader) {
        Optional<T> cached = get(kind, identity, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        T value = loader.get();
        if (value != null) {
            set(kind, identity, value);
        }
        return value;
    }

    public <T> T getOrCompute(CacheKind kind, String identity, TypeReference<T> type, Supplier<T> loader) {
        Optional<T> cached = get(kind, identity, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        T value = loader.get();
        if (value != null) {
            set(kind, identity, value);
        }
        return value;
    }

    public boolean evict(CacheKind kind, String identity) {
        return delete(kind, kind.key(identity));
    }

    public void invalidateCustomer(String customerId) {
        evict(CacheKind.CUSTOMER_HISTORY, customerId);
        evict(CacheKind.CUSTOMER_RISK_ANALYSIS, CustomerHistoryService.RISK_ANALYSIS_KEY);
    }

    public void invalidateIssue(String issueId) {
        evict(CacheKind.ISSUE_ANALYSIS, issueId);
        deletePattern(CacheKind.SIMILAR_ISSUES, CacheKind.SIMILAR_ISSUES.key(issueId) + ":*");
    }

    public CacheStats stats() {
        return new CacheStats(redisEnabled, localEntries(), hits.get(), misses.get(), redisFailures.get());
    }

    public Map<String, Object> healthCheck() {
        Map<String, Object> health = new LinkedHashMap<>();
        if (!redisEnabled) {
            health.put("status", "healthy");
            health.put("cacheType", "in_memory");
            return health;
        }
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            health.put("status", "PONG".equalsIgnoreCase(pong) ? "healthy" : "unhealthy");
            health.put("cacheType", "redis");
        } catch (RuntimeException e) {
            log.warn("Cache health check failed: {}", e.getMessage());
            health.put("status", "degraded");
            health.put("cacheType", "in_memory_fallback");
            health.put("error", e.getMessage());
        }
        health.put("localEntries", localEntries());
        return health;
    }

    private <T> Optional<T> read(CacheKind kind, String key, JavaType type) {
        String payload = null;
        boolean servedByRedis = false;
        if (redisEnabled) {
            try {
                payload = redisTemplate.opsForValue().get(key);
                servedByRedis = true;
            } catch (RuntimeException e) {
                redisFailures.incrementAndGet();
                log.warn("Redis get failed for key {}, trying local cache: {}", key, e.getMessage());
            }
        }
        if (!servedByRedis) {
            payload = localCaches.get(kind).getIfPresent(key);
        }

        if (payload == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        try {
            T value = objectMapper.readValue(payload, type);
            hits.incrementAndGet();
            return Optional.ofNullable(value);
        } catch (JsonProcessingException e) {
            log.warn("Evicting unreadable cache entry {}: {}", key, e.getOriginalMessage());
            delete(kind, key);
            misses.incrementAndGet();
            return Optional.empty();
        }
    }

    private boolean delete(CacheKind kind, String key) {
        boolean removed = localCaches.get(kind).asMap().remove(key) != null;
        if (redisEnabled) {
            try {
                removed |= Boolean.TRUE.equals(redisTemplate.delete(key));
            } catch (RuntimeException e) {
                redisFailures.incrementAndGet();
                log.warn("Redis delete failed for key {}: {}", key, e.getMessage());
            }
        }
        return removed;
    }

    private void deletePattern(CacheKind kind, String pattern) {
        String prefix = pattern.endsWith("*") ? pattern.substring(0, pattern.length() - 1) : pattern;
        localCaches.get(kind).asMap().keySet().removeIf(k -> k.startsWith(prefix));
        if (redisEnabled) {
            List<String> keys = new ArrayList<>();
            try (Cursor<String> cursor = redisTemplate.scan(ScanOptions.scanOptions().match(pattern).count(100).build())) {
                while (cursor.hasNext()) {
                    keys.add(cursor.next());
                }
                if (!keys.isEmpty()) {
                    redisTemplate.delete(keys);
                }
            } catch (RuntimeException e) {
                redisFailures.incrementAndGet();
                log.warn("Redis pattern delete failed for {}: {}", pattern, e.getMessage());
            }
        }
    }

    private int localEntries() {
        long total = 0;
        for (Cache<String, String> cache : localCaches.values()) {
            cache.cleanUp();
            total += cache.estimatedSize();
        }
        return (int) total;
    }
}
