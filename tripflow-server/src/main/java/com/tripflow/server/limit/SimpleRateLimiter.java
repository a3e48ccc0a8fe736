package com.tripflow.server.limit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Redis 的简单限流器：固定时间窗口 + 计数。
 *
 * 说明：
 * - 调用方决定限流维度（这里主要是会话 key），并传入唯一标识；
 * - 达到上限返回 false，由上层返回 RATE_LIMITED；
 * - Redis 不可用时放行，限流不应成为生成行程的单点故障。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SimpleRateLimiter {

    private static final String PREFIX = "rl:";

    private final StringRedisTemplate stringRedisTemplate;

    /**
     * @param bizKey       业务前缀，例如 task:start、task:replan
     * @param identify     限流维度标识，例如会话 key
     * @param windowSecond 时间窗口（秒）
     * @param maxCount     窗口内允许的最大次数
     * @return true 表示允许本次请求
     */
    public boolean tryAcquire(String bizKey, String identify, long windowSecond, long maxCount) {
        if (identify == null) {
            identify = "unknown";
        }
        String key = PREFIX + bizKey + ":" + identify;
        Long count;
        try {
            count = stringRedisTemplate.opsForValue().increment(key);
            if (count != null && count == 1L) {
                stringRedisTemplate.expire(key, windowSecond, TimeUnit.SECONDS);
            }
        } catch (DataAccessException e) {
            log.warn("限流计数失败，放行本次请求: bizKey={}, identify={}, err={}", bizKey, identify, e.getMessage());
            return true;
        }
        if (count == null) {
            return true;
        }
        boolean allowed = count <= maxCount;
        if (!allowed) {
            log.warn("限流触发: bizKey={}, identify={}, windowSecond={}, maxCount={}, current={}",
                    bizKey, identify, windowSecond, maxCount, count);
        }
        return allowed;
    }
}
