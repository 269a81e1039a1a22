package com.example.magiogateway.application.cache;

import com.example.magiogateway.common.config.AppCacheProperties;
import com.example.magiogateway.domain.model.CacheInfo;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Process-wide key/value cache with a per-entry expiry.
 * <p>
 * One lock guards both maps. Fetch functions passed to {@link #getOrFetch} run outside the
 * lock, so two threads missing the same key may both fetch; the later store wins.
 * Expired entries are invisible to readers even before {@link #sweepExpired()} removes them.
 */
@Component
public class TtlCache {

    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    private static final String PREFIX_WILDCARD = "*";

    private final AppCacheProperties properties;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, Object> values = new HashMap<>();
    private final Map<String, Long> expiresAtMillis = new HashMap<>();

    @Autowired
    public TtlCache(AppCacheProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public TtlCache(AppCacheProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public <T> T getOrFetch(String key, Class<T> type, Supplier<T> fetchFunction) {
        return getOrFetch(key, type, fetchFunction, properties.getDefaultTtlSeconds());
    }

    /**
     * Returns the cached value for {@code key}, or runs {@code fetchFunction} and caches its
     * result for {@code ttlSeconds}. A {@code null} result is returned but not cached. A cached
     * value that is not a {@code type} is treated as a miss and replaced.
     */
    public <T> T getOrFetch(String key, Class<T> type, Supplier<T> fetchFunction, long ttlSeconds) {
        lock.lock();
        try {
            if (isLive(key, clock.millis())) {
                Object value = values.get(key);
                if (type.isInstance(value)) {
                    log.debug("Cache hit: {}", key);
                    return type.cast(value);
                }
                log.warn("Cache entry {} holds {}, expected {}", key,
                        value.getClass().getSimpleName(), type.getSimpleName());
            }
        } finally {
            lock.unlock();
        }

        T data = fetchFunction.get();
        if (data != null) {
            store(key, data, ttlSeconds);
        }
        return data;
    }

    /**
     * Unexpired value for {@code key}, or {@code null}. A value of another type counts as absent.
     */
    public <T> T get(String key, Class<T> type) {
        lock.lock();
        try {
            if (!isLive(key, clock.millis())) {
                return null;
            }
            Object value = values.get(key);
            return type.isInstance(value) ? type.cast(value) : null;
        } finally {
            lock.unlock();
        }
    }

    public void store(String key, Object value) {
        store(key, value, properties.getDefaultTtlSeconds());
    }

    public void store(String key, Object value, long ttlSeconds) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("cache key and value must not be null");
        }
        lock.lock();
        try {
            values.put(key, value);
            expiresAtMillis.put(key, clock.millis() + ttlSeconds * 1000L);
        } finally {
            lock.unlock();
        }
        log.debug("Cache store: {} (ttl {}s)", key, ttlSeconds);
    }

    public void clear() {
        lock.lock();
        try {
            values.clear();
            expiresAtMillis.clear();
        } finally {
            lock.unlock();
        }
        log.info("Cache cleared");
    }

    /**
     * Removes one key, or every key starting with the prefix when {@code key} ends with
     * {@code *}. A {@code null} key clears everything.
     *
     * @return number of removed entries
     */
    public int clear(String key) {
        if (key == null) {
            int size = size();
            clear();
            return size;
        }
        int removed = 0;
        lock.lock();
        try {
            if (values.containsKey(key)) {
                values.remove(key);
                expiresAtMillis.remove(key);
                removed = 1;
            } else if (key.endsWith(PREFIX_WILDCARD)) {
                String prefix = key.substring(0, key.length() - 1);
                Iterator<String> it = values.keySet().iterator();
                while (it.hasNext()) {
                    String candidate = it.next();
                    if (candidate.startsWith(prefix)) {
                        it.remove();
                        expiresAtMillis.remove(candidate);
                        removed++;
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.info("Cache entries cleared: key={}, removed={}", key, removed);
        }
        return removed;
    }

    public CacheInfo info() {
        lock.lock();
        try {
            long now = clock.millis();
            Map<String, Long> expiresIn = new TreeMap<>();
            int expired = 0;
            for (Map.Entry<String, Long> entry : expiresAtMillis.entrySet()) {
                long remaining = entry.getValue() - now;
                if (remaining > 0) {
                    expiresIn.put(entry.getKey(), remaining / 1000L);
                } else {
                    expired++;
                }
            }
            Map<String, Integer> categories = new TreeMap<>();
            for (String key : values.keySet()) {
                categories.merge(categoryOf(key), 1, Integer::sum);
            }
            List<String> keys = new ArrayList<>(values.keySet());
            keys.sort(null);
            return new CacheInfo(values.size(), expired, categories, keys, expiresIn);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Physically removes expired entries.
     *
     * @return number of removed entries
     */
    public int sweepExpired() {
        int removed = 0;
        lock.lock();
        try {
            long now = clock.millis();
            Iterator<Map.Entry<String, Long>> it = expiresAtMillis.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Long> entry = it.next();
                if (entry.getValue() <= now) {
                    values.remove(entry.getKey());
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.debug("Swept {} expired cache entries", removed);
        }
        return removed;
    }

    public int size() {
        lock.lock();
        try {
            return values.size();
        } finally {
            lock.unlock();
        }
    }

    private boolean isLive(String key, long nowMillis) {
        Long expiry = expiresAtMillis.get(key);
        return expiry != null && nowMillis < expiry && values.containsKey(key);
    }

    static String categoryOf(String key) {
        int idx = key.indexOf('_');
        return idx > 0 ? key.substring(0, idx) : "other";
    }
}
