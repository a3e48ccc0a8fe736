package com.tripflow.server.progress;

import com.tripflow.pojo.model.task.TaskSnapshot;

/**
 * 任务进度订阅者。回调在发布线程上执行，抛异常的订阅者会被移除。
 */
public interface ProgressListener {

    void onSnapshot(TaskSnapshot snapshot);

    /**
     * 任务进入终态、频道关闭后调用一次。
     */
    void onClose();
}
