package com.example.magiogateway.api.controller;

import com.example.magiogateway.api.response.ApiResponse;
import com.example.magiogateway.application.cache.TtlCache;
import com.example.magiogateway.domain.model.CacheInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/cache")
public class CacheController {

    private static final Logger log = LoggerFactory.getLogger(CacheController.class);

    private final TtlCache cache;

    public CacheController(TtlCache cache) {
        this.cache = cache;
    }

    @GetMapping
    public ApiResponse<CacheInfo> info() {
        return ApiResponse.success(cache.info());
    }

    @DeleteMapping
    public ApiResponse<Integer> clear(@RequestParam(value = "key", required = false) String key) {
        String target = StringUtils.hasText(key) ? key.trim() : null;
        int removed = cache.clear(target);
        log.info("Cache cleared via API, key={}, removed={}", target == null ? "<all>" : target, removed);
        return ApiResponse.success(removed);
    }

    @PostMapping("/sweep")
    public ApiResponse<Integer> sweep() {
        return ApiResponse.success(cache.sweepExpired());
    }
}
