package com.prepair.backend.service;

import jakarta.persistence.Entity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

@Service
@Slf4j
@RequiredArgsConstructor
public class CacheService {

    private final RedisTemplate<String, Object> redisTemplate;

    /**
     * Cache-Aside Pattern:
     * 1. Try Redis
     * 2. Compute if missing
     * 3. Cache ONLY if safe
     *
     * Redis failures never fail the caller; the value is computed exactly once
     * and exceptions from the computation propagate unchanged.
     */
    public <T> T getOrCompute(
            String key,
            Class<T> type,
            Supplier<T> computeFunction,
            Duration ttl
    ) {
        // 1️⃣ Try to get from cache
        try {
            Object cached = redisTemplate.opsForValue().get(key);
            if (type.isInstance(cached)) {
                log.debug("✅ Cache HIT for key: {}", key);
                return type.cast(cached);
            }
        } catch (DataAccessException e) {
            log.warn("❌ Redis read failed for key: {}. Computing instead.", key, e);
        }

        // 2️⃣ Cache MISS → compute
        log.debug("⚠️ Cache MISS for key: {}", key);
        T computed = computeFunction.get();
        if (computed == null) {
            return null;
        }

        // 3️⃣ Safe to cache
        put(key, computed, ttl);
        return computed;
    }

    public void put(String key, Object value, Duration ttl) {
        // ❌ NEVER cache JPA entities
        if (value != null && value.getClass().isAnnotationPresent(Entity.class)) {
            log.warn("🚫 Skipping Redis put for JPA entity: {} (key={})", value.getClass().getSimpleName(), key);
            return;
        }
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
            log.debug("📦 Cached value for key: {}", key);
        } catch (DataAccessException e) {
            log.warn("❌ Redis write failed for key: {}", key, e);
        }
    }

    public void invalidate(String key) {
        try {
            redisTemplate.delete(key);
            log.debug("🗑️ Invalidated cache for key: {}", key);
        } catch (DataAccessException e) {
            log.warn("❌ Redis delete failed for key: {}", key, e);
        }
    }
}
