package com.example.reminder.cron.controller;

import com.example.reminder.cron.dto.SyncCacheResponse;
import com.example.reminder.shared.dto.CacheStatus;
import com.example.reminder.shared.dto.CacheSyncResult;
import com.example.reminder.shared.model.CachedSchedule;
import com.example.reminder.shared.service.cache.ScheduleCacheService;
import com.example.reminder.shared.service.cache.SourceStore;
import com.example.reminder.shared.service.marker.IdempotencyTracker;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/schedules")
@RequiredArgsConstructor
@Slf4j
public class ScheduleCacheController {

    private final ScheduleCacheService scheduleCacheService;
    private final SourceStore sourceStore;
    private final IdempotencyTracker idempotencyTracker;
    private final Clock clock;

    @PostMapping("/sync-cache")
    @RateLimiter(name = "syncCacheLimiter", fallbackMethod = "syncFallback")
    public Mono<ResponseEntity<SyncCacheResponse>> syncCache() {
        return Mono.fromCallable(() -> scheduleCacheService.sync(sourceStore))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> {
                    if (!result.isSuccess()) {
                        throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to sync schedule cache: " + result.getError());
                    }
                    return ResponseEntity.ok(toResponse(result));
                });
    }

    public Mono<ResponseEntity<SyncCacheResponse>> syncFallback(RequestNotPermitted ex) {
        log.warn("Cache sync rate limit exceeded: {}", ex.getMessage());
        return Mono.error(new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, "Too many sync requests. Please try again later."));
    }

    @GetMapping("/sync-cache/status")
    public Mono<ResponseEntity<CacheStatus>> cacheStatus() {
        return Mono.fromCallable(scheduleCacheService::status)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/sent-today")
    public Mono<ResponseEntity<Map<String, Instant>>> sentToday() {
        return Mono.fromCallable(() -> {
                    List<String> ids = scheduleCacheService.read().stream()
                            .map(CachedSchedule::getId)
                            .collect(Collectors.toList());
                    return idempotencyTracker.sentToday(ids, clock.instant());
                })
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/{id}/sent-marker")
    public Mono<ResponseEntity<Map<String, Boolean>>> clearSentMarker(@PathVariable String id) {
        return Mono.fromCallable(() -> idempotencyTracker.clearForSchedule(id, clock.instant()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(cleared -> ResponseEntity.ok(Map.of("cleared", cleared)));
    }

    private static SyncCacheResponse toResponse(CacheSyncResult result) {
        return new SyncCacheResponse(result.getCount(), result.getSyncedAt());
    }
}
