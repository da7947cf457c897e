package com.example.lxmon.queue;

import java.time.Duration;
import java.util.Optional;

/**
 * Adapter over the queue/cache service: a FIFO command list per server and a
 * key/value cache whose entries expire after a TTL.
 *
 * <p>Queue operations address the list {@code commands:{serverId}}. Payloads and
 * cache values are opaque strings; callers own their encoding. Backend failures
 * surface as {@link com.example.lxmon.exception.QueueCacheException}.
 */
public interface QueueCacheClient {

    /** Appends {@code payload} to the tail of the server's queue. */
    void push(long serverId, String payload);

    /** Removes and returns the head of the server's queue, or empty when it is empty. */
    Optional<String> pop(long serverId);

    long queueLength(long serverId);

    void setCache(String key, String value, Duration ttl);

    Optional<String> getCache(String key);

    /** @return true if a key was removed */
    boolean deleteCache(String key);

    /** @return true if the backend answered */
    boolean ping();

    static String queueKey(long serverId) {
        return "commands:" + serverId;
    }
}
