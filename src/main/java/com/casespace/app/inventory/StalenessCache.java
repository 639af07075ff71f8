package com.casespace.app.inventory;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.casespace.app.config.Config;
import com.casespace.app.inventory.StalenessVerifier.Verdict;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

/**
 * Cache curto dos veredictos de staleness por id. Só consulta: quem escreve invalida
 * os ids que mexeu e nunca lê daqui.
 */
public final class StalenessCache {

    private static final Logger logger = LoggerFactory.getLogger(StalenessCache.class);

    private final Cache<String, Verdict> cache;

    public StalenessCache(Duration ttl, long maxSize, Ticker ticker) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .recordStats()
                .build();
        logger.debug("Staleness cache: ttl={}, maxSize={}", ttl, maxSize);
    }

    public static StalenessCache defaults() {
        return new StalenessCache(Config.getStalenessTtl(), Config.getStalenessCacheSize(), Ticker.systemTicker());
    }

    public Optional<Verdict> get(String entryId) {
        return Optional.ofNullable(cache.getIfPresent(entryId));
    }

    public void put(String entryId, Verdict verdict) {
        cache.put(entryId, verdict);
    }

    public void invalidateAll(Collection<String> entryIds) {
        if (entryIds == null || entryIds.isEmpty()) return;
        cache.invalidateAll(entryIds);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
