package com.tripflow.server.utils;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RedisIdWorker 的基础单元测试：
 * - 同一时间窗口内 ID 单调递增（依赖 Redis 自增序列）；
 * - 自增 key 按业务前缀与日期区分。
 */
@ExtendWith(MockitoExtension.class)
class RedisIdWorkerTest {

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisIdWorker redisIdWorker;

    @BeforeEach
    void setUp() {
        lenient().when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        Clock clock = Clock.fixed(Instant.parse("2026-03-15T10:00:00Z"), ZoneOffset.UTC);
        redisIdWorker = new RedisIdWorker(stringRedisTemplate, clock);
    }

    @Test
    void nextIdShouldGenerateMonotonicallyIncreasingIds() {
        when(valueOperations.increment(anyString())).thenReturn(1L, 2L, 3L);

        long id1 = redisIdWorker.nextId("task");
        long id2 = redisIdWorker.nextId("task");

        assertTrue(id2 > id1, "second id should be greater than first id");
        assertEquals(1L, id2 - id1);
    }

    @Test
    void counterKeyIsPerPrefixAndDay() {
        when(valueOperations.increment("icr:version:2026:03:15")).thenReturn(7L);

        long id = redisIdWorker.nextId("version");

        assertEquals(7L, id & 0xffffffffL);
        verify(valueOperations).increment("icr:version:2026:03:15");
    }
}
