package com.tripflow.server.intent;

import com.tripflow.pojo.model.context.ConversationContext;
import com.tripflow.pojo.model.context.ExtractedSlot;

import java.util.List;

/**
 * 从单条用户消息中抽取槽位。实现不抛异常：抽取不到返回空列表。
 */
public interface IntentExtractor {

    /**
     * @param message 用户消息
     * @param context 当前会话上下文（只读），用于解析“第二天”等相对表达
     */
    List<ExtractedSlot> extract(String message, ConversationContext context);
}
