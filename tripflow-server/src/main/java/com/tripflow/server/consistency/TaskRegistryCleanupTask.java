package com.tripflow.server.consistency;

import com.tripflow.common.exception.StorageUnavailableException;
import com.tripflow.common.properties.PlannerProperties;
import com.tripflow.common.result.ErrorCode;
import com.tripflow.pojo.model.task.TaskSnapshot;
import com.tripflow.pojo.model.task.TaskStatus;
import com.tripflow.server.progress.TaskSnapshotRepository;
import com.tripflow.server.task.TaskStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * 任务注册表维护：
 * - 长时间没有进展的运行中任务按 TASK_TIMEOUT 失败；
 * - 持久化快照未终态、但没有任何进程在执行的孤儿任务同样按 TASK_TIMEOUT 失败；
 * - 终态任务超过保留时间后从内存移除，之后只能通过持久化快照查询。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskRegistryCleanupTask {

    /** 运行中任务两次快照之间的最长间隔不超过整体时限，再留出时钟偏差 */
    static final long ORPHAN_GRACE_MS = 60_000L;

    private final TaskStateMachine taskStateMachine;
    private final TaskSnapshotRepository taskSnapshotRepository;
    private final PlannerProperties plannerProperties;
    private final Clock clock;

    @Scheduled(fixedDelay = 60_000L, initialDelay = 60_000L)
    public void cleanup() {
        List<Long> stale = taskStateMachine.staleTasks(TimeUnit.MINUTES.toMillis(plannerProperties.getStaleTaskMinutes()));
        for (Long taskId : stale) {
            log.warn("任务长时间无进展，标记为超时: taskId={}", taskId);
            taskStateMachine.fail(taskId, ErrorCode.TASK_TIMEOUT, true, "任务长时间无进展");
        }
        int orphans = failOrphanedTasks();
        int evicted = taskStateMachine.evictTerminal(TimeUnit.MINUTES.toMillis(plannerProperties.getTerminalRetentionMinutes()));
        if (!stale.isEmpty() || orphans > 0 || evicted > 0) {
            log.info("任务注册表清理完成: stale={}, orphans={}, evicted={}", stale.size(), orphans, evicted);
        }
    }

    /**
     * 扫描持久化的活跃任务集合。本进程未登记的任务，如果快照停止更新超过阈值，说明执行它的进程已不存在：
     * running 任务的阈值是整体时限加宽限，pending 任务可能还在队列里，阈值取 staleTaskMinutes。
     *
     * @return 结束的孤儿任务数量
     */
    int failOrphanedTasks() {
        Set<Long> active;
        try {
            active = taskSnapshotRepository.activeTaskIds();
        } catch (StorageUnavailableException e) {
            log.warn("读取活跃任务集合失败，跳过孤儿任务清理", e);
            return 0;
        }
        long now = clock.millis();
        long runningLimit = plannerProperties.getTaskTimeoutMs() + ORPHAN_GRACE_MS;
        long pendingLimit = TimeUnit.MINUTES.toMillis(plannerProperties.getStaleTaskMinutes());
        int failed = 0;
        for (Long taskId : active) {
            if (taskStateMachine.isRegistered(taskId)) {
                continue;
            }
            try {
                TaskSnapshot stored = taskSnapshotRepository.load(taskId);
                if (stored == null || stored.isTerminal()) {
                    taskSnapshotRepository.removeActive(taskId);
                    continue;
                }
                long limit = stored.getStatus() == TaskStatus.PENDING ? pendingLimit : runningLimit;
                if (now - stored.getUpdatedAt() <= limit) {
                    continue;
                }
                if (taskStateMachine.failOrphan(stored, ErrorCode.TASK_TIMEOUT, "执行任务的进程已不存在") != null) {
                    failed++;
                }
            } catch (StorageUnavailableException e) {
                log.warn("处理孤儿任务失败: taskId={}", taskId, e);
            }
        }
        return failed;
    }
}
