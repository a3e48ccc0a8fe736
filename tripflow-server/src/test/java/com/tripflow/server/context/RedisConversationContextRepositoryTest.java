package com.tripflow.server.context;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.common.exception.StorageUnavailableException;
import com.tripflow.pojo.model.context.ConversationContext;
import com.tripflow.pojo.model.context.SlotName;
import com.tripflow.pojo.model.context.SlotValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RedisConversationContextRepository 单元测试：
 * - 写入时不设置过期时间，上下文只能被显式删除；
 * - 读取不存在的 key 返回 null；
 * - Redis 故障与数据损坏都以 StorageUnavailableException 抛出。
 */
@ExtendWith(MockitoExtension.class)
class RedisConversationContextRepositoryTest {

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private RedisConversationContextRepository repository;

    @BeforeEach
    void setUp() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        repository = new RedisConversationContextRepository(stringRedisTemplate, objectMapper);
    }

    @Test
    void saveShouldWriteWithoutExpiry() {
        ConversationContext ctx = new ConversationContext("c1", 1L);
        ctx.getSlots().put(SlotName.DESTINATION, new SlotValue("Phuket", 0, 0.9));

        repository.save(ctx);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("conversation:ctx:c1"), json.capture());
        verify(valueOperations, never()).set(anyString(), anyString(), anyLong(), any(TimeUnit.class));
        assertTrue(json.getValue().contains("Phuket"));
    }

    @Test
    void loadOfUnknownKeyReturnsNull() {
        when(valueOperations.get("conversation:ctx:nope")).thenReturn(null);

        assertNull(repository.load("nope"));
    }

    @Test
    void corruptedContextShouldNotBeTreatedAsNew() {
        when(valueOperations.get("conversation:ctx:c1")).thenReturn("{not json");

        assertThrows(StorageUnavailableException.class, () -> repository.load("c1"));
    }

    @Test
    void redisFailureOnSaveShouldSurface() {
        ConversationContext ctx = new ConversationContext("c1", 1L);
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOperations).set(anyString(), anyString());

        assertThrows(StorageUnavailableException.class, () -> repository.save(ctx));
    }
}
