package com.tripflow.server.progress;

import com.tripflow.pojo.model.task.TaskSnapshot;

import java.util.Set;

/**
 * 任务快照的持久化存储。
 */
public interface TaskSnapshotRepository {

    void save(TaskSnapshot snapshot);

    /**
     * @return 不存在或已过期时返回 null
     */
    TaskSnapshot load(Long taskId);

    /**
     * 尚未进入终态的任务 id。
     */
    Set<Long> activeTaskIds();

    /**
     * 快照已过期但仍留在活跃集合中的 id，清理时移除。
     */
    void removeActive(Long taskId);
}
