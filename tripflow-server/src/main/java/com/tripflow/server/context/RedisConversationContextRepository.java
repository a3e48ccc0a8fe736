package com.tripflow.server.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.common.constant.RedisConstants;
import com.tripflow.common.exception.StorageUnavailableException;
import com.tripflow.pojo.model.context.ConversationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

/**
 * 会话上下文存放在 Redis：conversation:ctx:{key} -> JSON，不过期。
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class RedisConversationContextRepository implements ConversationContextRepository {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public ConversationContext load(String key) {
        String json;
        try {
            json = stringRedisTemplate.opsForValue().get(RedisConstants.CONVERSATION_CONTEXT_KEY + key);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("读取会话上下文失败", e);
        }
        if (!StringUtils.hasText(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, ConversationContext.class);
        } catch (JsonProcessingException e) {
            // 上下文损坏时不能当作新会话处理，否则会丢失已确认的槽位
            log.error("会话上下文反序列化失败, key={}", key, e);
            throw new StorageUnavailableException("会话上下文数据损坏", e);
        }
    }

    @Override
    public void save(ConversationContext context) {
        String json;
        try {
            json = objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("会话上下文序列化失败", e);
        }
        try {
            stringRedisTemplate.opsForValue().set(RedisConstants.CONVERSATION_CONTEXT_KEY + context.getKey(), json);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("写入会话上下文失败", e);
        }
    }
}
