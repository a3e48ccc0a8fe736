package com.tripflow.server.limit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SimpleRateLimiter 的单元测试：
 * - 首次计数时设置窗口过期；
 * - 超过上限拒绝；
 * - Redis 异常时放行。
 */
@ExtendWith(MockitoExtension.class)
class SimpleRateLimiterTest {

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private SimpleRateLimiter limiter;

    @BeforeEach
    void setUp() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        limiter = new SimpleRateLimiter(stringRedisTemplate);
    }

    @Test
    void firstHitShouldSetWindowExpire() {
        when(valueOperations.increment("rl:task:start:c1")).thenReturn(1L);

        assertTrue(limiter.tryAcquire("task:start", "c1", 60, 3));
        verify(stringRedisTemplate).expire("rl:task:start:c1", 60, TimeUnit.SECONDS);
    }

    @Test
    void overLimitShouldBeRejected() {
        when(valueOperations.increment("rl:task:start:c1")).thenReturn(4L);

        assertFalse(limiter.tryAcquire("task:start", "c1", 60, 3));
        verify(stringRedisTemplate, never()).expire(anyString(), anyLong(), any(TimeUnit.class));
    }

    @Test
    void redisFailureShouldLetRequestThrough() {
        when(valueOperations.increment(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertTrue(limiter.tryAcquire("task:start", "c1", 60, 3));
    }
}
