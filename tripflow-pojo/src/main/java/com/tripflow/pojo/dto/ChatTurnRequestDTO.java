package com.tripflow.pojo.dto;

import lombok.Data;

/**
 * 对话请求体 DTO。
 * Request body for one conversation turn.
 */
@Data
public class ChatTurnRequestDTO {

    /**
     * 会话 key，首轮为空时由服务端生成。
     * Conversation key, generated on the first turn when absent.
     */
    private String conversationKey;

    /**
     * 客户端分配的轮次 ID，用于重试去重。
     * Client assigned turn id used for deduplication.
     */
    private String turnId;

    /**
     * 用户输入。
     */
    private String message;

    /**
     * 为 true 时槽位齐全即开始生成行程。
     */
    private Boolean generate;
}
