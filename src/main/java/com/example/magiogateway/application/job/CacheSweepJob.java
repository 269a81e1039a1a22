package com.example.magiogateway.application.job;

import com.example.magiogateway.application.cache.TtlCache;
import com.example.magiogateway.common.config.AppCacheProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class CacheSweepJob {

    private static final Logger log = LoggerFactory.getLogger(CacheSweepJob.class);

    private final TtlCache cache;
    private final AppCacheProperties cacheProperties;

    public CacheSweepJob(TtlCache cache, AppCacheProperties cacheProperties) {
        this.cache = cache;
        this.cacheProperties = cacheProperties;
    }

    @Scheduled(fixedDelayString = "${app.cache.sweep-interval-ms:300000}",
            initialDelayString = "${app.cache.sweep-interval-ms:300000}")
    public void sweep() {
        if (!cacheProperties.isSweepEnabled()) {
            return;
        }
        try {
            int removed = cache.sweepExpired();
            if (removed > 0) {
                log.info("Cache sweep removed {} expired entries, {} remain", removed, cache.size());
            }
        } catch (Exception e) {
            log.error("Cache sweep failed", e);
        }
    }
}
