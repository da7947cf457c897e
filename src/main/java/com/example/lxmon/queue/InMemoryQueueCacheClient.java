package com.example.lxmon.queue;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * In-process queue and cache for single-node deployments and tests.
 * Mirrors the Redis layout: push at the head, pop from the tail.
 */
@Component
@ConditionalOnProperty(prefix = "lxmon.queue", name = "backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryQueueCacheClient implements QueueCacheClient {

    private final Map<Long, Deque<String>> queues = new ConcurrentHashMap<>();
    private final Cache<String, CachedValue> cache;

    public InMemoryQueueCacheClient() {
        this(Ticker.systemTicker());
    }

    InMemoryQueueCacheClient(Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .ticker(ticker)
                .maximumSize(10_000)
                .expireAfter(new TtlExpiry())
                .build();
    }

    @Override
    public void push(long serverId, String payload) {
        queues.computeIfAbsent(serverId, id -> new ConcurrentLinkedDeque<>()).addFirst(payload);
    }

    @Override
    public Optional<String> pop(long serverId) {
        Deque<String> queue = queues.get(serverId);
        return queue == null ? Optional.empty() : Optional.ofNullable(queue.pollLast());
    }

    @Override
    public long queueLength(long serverId) {
        Deque<String> queue = queues.get(serverId);
        return queue == null ? 0L : queue.size();
    }

    @Override
    public void setCache(String key, String value, Duration ttl) {
        cache.put(key, new CachedValue(value, ttl));
    }

    @Override
    public Optional<String> getCache(String key) {
        return Optional.ofNullable(cache.getIfPresent(key)).map(CachedValue::value);
    }

    @Override
    public boolean deleteCache(String key) {
        return cache.asMap().remove(key) != null;
    }

    @Override
    public boolean ping() {
        return true;
    }

    private record CachedValue(String value, Duration ttl) {}

    private static final class TtlExpiry implements Expiry<String, CachedValue> {

        @Override
        public long expireAfterCreate(String key, CachedValue value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CachedValue value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CachedValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
