package com.tripflow.server.task;

/**
 * 流水线在检查点发现任务已被取消（或已进入终态）时抛出，只在流水线内部使用。
 */
public class TaskCancelledException extends RuntimeException {

    private final Long taskId;

    public TaskCancelledException(Long taskId) {
        super("task " + taskId + " cancelled");
        this.taskId = taskId;
    }

    public Long getTaskId() {
        return taskId;
    }
}
