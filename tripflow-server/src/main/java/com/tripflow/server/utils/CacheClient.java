package com.tripflow.server.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.server.metrics.MetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Redis 读穿缓存。行程版本不可变，因此只需要“空值缓存防穿透”，不需要逻辑过期重建。
 * 缓存层不可用时直接回源，缓存故障不影响主流程。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheClient {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final MetricsRecorder metricsRecorder;

    public void set(String key, Object value, long time, TimeUnit unit) {
        try {
            String json = objectMapper.writeValueAsString(value);
            stringRedisTemplate.opsForValue().set(key, json, time, unit);
        } catch (JsonProcessingException e) {
            log.error("序列化缓存对象失败, key={}", key, e);
        } catch (DataAccessException e) {
            log.warn("写缓存失败, key={}: {}", key, e.getMessage());
        }
    }

    public void evict(String key) {
        try {
            stringRedisTemplate.delete(key);
        } catch (DataAccessException e) {
            log.warn("删除缓存失败, key={}: {}", key, e.getMessage());
        }
    }

    /**
     * 缓存穿透：空值缓存防护
     */
    public <R, ID> R queryWithPassThrough(
            String keyPrefix, ID id, Class<R> type,
            Function<ID, R> dbFallback, long time, TimeUnit unit, long nullTtlMinutes) {
        String key = keyPrefix + id;
        String json;
        try {
            json = stringRedisTemplate.opsForValue().get(key);
        } catch (DataAccessException e) {
            log.warn("读缓存失败，直接回源, key={}: {}", key, e.getMessage());
            return dbFallback.apply(id);
        }
        if (StringUtils.hasText(json)) {
            metricsRecorder.recordVersionCacheHit(true);
            try {
                return objectMapper.readValue(json, type);
            } catch (Exception e) {
                // 缓存内容损坏时回源，并用新值覆盖
                log.error("反序列化缓存失败, key={}", key, e);
            }
        } else if (json != null) {
            // 空字符串：命中空值缓存
            metricsRecorder.recordVersionCacheHit(true);
            return null;
        }
        R r = dbFallback.apply(id);
        metricsRecorder.recordVersionCacheHit(false);
        if (r == null) {
            try {
                stringRedisTemplate.opsForValue().set(key, "", nullTtlMinutes, TimeUnit.MINUTES);
            } catch (DataAccessException e) {
                log.warn("写空值缓存失败, key={}: {}", key, e.getMessage());
            }
            return null;
        }
        set(key, r, time, unit);
        return r;
    }
}
