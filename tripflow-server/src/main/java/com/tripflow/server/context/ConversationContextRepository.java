package com.tripflow.server.context;

import com.tripflow.pojo.model.context.ConversationContext;

/**
 * 会话上下文持久化。存储故障以 StorageUnavailableException 抛出。
 */
public interface ConversationContextRepository {

    /**
     * @return 不存在时返回 null
     */
    ConversationContext load(String key);

    void save(ConversationContext context);
}
