package com.tripflow.pojo.dto;

import lombok.Data;

/**
 * 发起行程生成任务。
 */
@Data
public class StartTaskRequestDTO {

    private String conversationKey;

    /**
     * 请求去重 ID：相同 requestId 重复提交返回同一个任务。
     */
    private String requestId;
}
