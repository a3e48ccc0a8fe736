package com.tripflow.server.task;

import lombok.Value;

@Value
public class StartedTask {

    Long taskId;

    /** 相同 requestId 的重复提交，任务已存在，无需再次分发 */
    boolean duplicate;
}
