package com.tripflow.server.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.server.metrics.MetricsRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * CacheClient 的基础单元测试：
 * - 覆盖缓存命中场景；
 * - 覆盖缓存穿透（空值缓存）场景；
 * - Redis 不可用时直接回源。
 *
 * 说明：这里使用 Mockito 模拟 Redis 行为，不依赖真实 Redis 实例。
 */
@ExtendWith(MockitoExtension.class)
class CacheClientTest {

    private static final String KEY_PREFIX = "cache:test:";

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private MetricsRecorder metricsRecorder;

    private ObjectMapper objectMapper;
    private CacheClient cacheClient;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        cacheClient = new CacheClient(stringRedisTemplate, objectMapper, metricsRecorder);
    }

    @Test
    void queryWithPassThrough_shouldReturnCachedValue_whenCacheHit() throws Exception {
        TestDto dto = new TestDto();
        dto.setId(1L);
        dto.setName("cached");
        when(valueOperations.get(KEY_PREFIX + 1L)).thenReturn(objectMapper.writeValueAsString(dto));

        Function<Long, TestDto> dbFallback = unused -> {
            throw new IllegalStateException("dbFallback should not be called when cache hit");
        };

        TestDto result = cacheClient.queryWithPassThrough(KEY_PREFIX, 1L, TestDto.class, dbFallback,
                10, TimeUnit.MINUTES, 5);

        assertEquals("cached", result.getName());
        verify(metricsRecorder).recordVersionCacheHit(true);
        verify(valueOperations, never()).set(anyString(), anyString(), anyLong(), any(TimeUnit.class));
    }

    @Test
    void queryWithPassThrough_shouldCacheEmptyAndReturnNull_whenDbReturnsNull() {
        when(valueOperations.get(KEY_PREFIX + 2L)).thenReturn(null);

        TestDto result = cacheClient.queryWithPassThrough(KEY_PREFIX, 2L, TestDto.class, unused -> null,
                10, TimeUnit.MINUTES, 3);

        assertNull(result);
        // 数据库返回 null 时写入空字符串并设置短 TTL，防止缓存穿透
        verify(valueOperations).set(eq(KEY_PREFIX + 2L), eq(""), eq(3L), eq(TimeUnit.MINUTES));
    }

    @Test
    void queryWithPassThrough_shouldReturnNull_whenHitNullCache() {
        when(valueOperations.get(KEY_PREFIX + 3L)).thenReturn("");

        Function<Long, TestDto> dbFallback = unused -> {
            throw new IllegalStateException("dbFallback should not be called when hit null-cache");
        };

        assertNull(cacheClient.queryWithPassThrough(KEY_PREFIX, 3L, TestDto.class, dbFallback,
                10, TimeUnit.MINUTES, 3));
    }

    @Test
    void queryWithPassThrough_shouldWriteBack_whenCacheMiss() throws Exception {
        when(valueOperations.get(KEY_PREFIX + 4L)).thenReturn(null);
        TestDto fromDb = new TestDto();
        fromDb.setId(4L);
        fromDb.setName("db");

        TestDto result = cacheClient.queryWithPassThrough(KEY_PREFIX, 4L, TestDto.class, unused -> fromDb,
                30, TimeUnit.MINUTES, 3);

        assertEquals("db", result.getName());
        verify(valueOperations).set(KEY_PREFIX + 4L, objectMapper.writeValueAsString(fromDb), 30L, TimeUnit.MINUTES);
        verify(metricsRecorder).recordVersionCacheHit(false);
    }

    @Test
    void queryWithPassThrough_shouldFallBackToDb_whenRedisDown() {
        when(valueOperations.get(KEY_PREFIX + 5L)).thenThrow(new RedisConnectionFailureException("down"));
        TestDto fromDb = new TestDto();
        fromDb.setId(5L);

        TestDto result = cacheClient.queryWithPassThrough(KEY_PREFIX, 5L, TestDto.class, unused -> fromDb,
                30, TimeUnit.MINUTES, 3);

        assertEquals(5L, result.getId());
    }

    /**
     * 测试用简单 DTO。
     */
    private static class TestDto {
        private Long id;
        private String name;

        public Long getId() {
            return id;
        }

        public void setId(Long id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }
}
