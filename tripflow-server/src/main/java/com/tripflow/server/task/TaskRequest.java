package com.tripflow.server.task;

import com.tripflow.pojo.dto.ReplanRequestDTO;
import com.tripflow.pojo.model.task.TaskKind;
import lombok.Builder;
import lombok.Value;

/**
 * 发起任务的请求。replan 时 parentVersionId 与 modification 非空。
 */
@Value
@Builder
public class TaskRequest {

    TaskKind kind;

    String conversationKey;

    /** 可选的去重 ID */
    String requestId;

    Long parentVersionId;

    ReplanRequestDTO modification;
}
