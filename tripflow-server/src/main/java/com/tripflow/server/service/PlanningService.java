package com.tripflow.server.service;

import com.tripflow.pojo.model.task.TaskSnapshot;
import com.tripflow.server.task.TaskRequest;

/**
 * 任务入口：限流、创建任务并分发，以及取消与查询。
 */
public interface PlanningService {

    /**
     * @return 任务 ID；相同 requestId 的重复请求返回已有任务
     */
    Long start(TaskRequest request);

    TaskSnapshot cancel(Long taskId);

    TaskSnapshot poll(Long taskId);
}
