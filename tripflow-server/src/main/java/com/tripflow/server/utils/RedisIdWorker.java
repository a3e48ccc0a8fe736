package com.tripflow.server.utils;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * 基于「时间戳 + Redis 自增序列」生成全局唯一 ID，用于任务 ID、行程 ID 与版本 ID。
 * 高位为相对起始时间的秒数，低位为当日自增序号，整体有序且多实例不冲突。
 */
@Component
@RequiredArgsConstructor
public class RedisIdWorker {

    /**
     * 起始时间戳：2024-01-01 00:00:00（UTC）。
     */
    private static final long BEGIN_TIMESTAMP = 1704067200L;

    /**
     * 低 32 位为每日自增序列。
     */
    private static final int COUNT_BITS = 32;

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyy:MM:dd");

    private final StringRedisTemplate stringRedisTemplate;

    private final Clock clock;

    public long nextId(String keyPrefix) {
        LocalDateTime now = LocalDateTime.now(clock);
        long timestamp = now.toEpochSecond(ZoneOffset.UTC) - BEGIN_TIMESTAMP;

        // 不同 keyPrefix 独立计数，按天分 key 防止单 key 无限增长
        String key = "icr:" + keyPrefix + ":" + now.format(DAY_FORMAT);
        Long count = stringRedisTemplate.opsForValue().increment(key);

        return (timestamp << COUNT_BITS) | (count != null ? count : 0L);
    }
}
