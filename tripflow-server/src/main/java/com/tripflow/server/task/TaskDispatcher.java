package com.tripflow.server.task;

/**
 * 把已创建的任务交给执行端。
 */
public interface TaskDispatcher {

    void dispatch(TaskCommand command);
}
