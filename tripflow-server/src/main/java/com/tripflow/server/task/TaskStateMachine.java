package com.tripflow.server.task;

import com.tripflow.common.constant.RedisConstants;
import com.tripflow.common.exception.InvalidRequestException;
import com.tripflow.common.exception.UnknownTaskException;
import com.tripflow.common.result.ErrorCode;
import com.tripflow.pojo.model.context.SlotName;
import com.tripflow.pojo.model.source.SourceStatus;
import com.tripflow.pojo.model.task.TaskKind;
import com.tripflow.pojo.model.task.TaskSnapshot;
import com.tripflow.pojo.model.task.TaskStatus;
import com.tripflow.pojo.model.task.TaskStep;
import com.tripflow.server.context.ConversationContextStore;
import com.tripflow.server.context.RequiredSlots;
import com.tripflow.server.metrics.MetricsRecorder;
import com.tripflow.server.progress.ProgressPublisher;
import com.tripflow.server.utils.RedisIdWorker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 任务状态机。
 * <p>
 * 状态：pending -> running -> completed / failed，pending / running -> cancelled。
 * 同一任务的所有状态变更在该任务记录的锁内完成，快照也在锁内发布，
 * 因此订阅者看到的顺序与调用顺序一致，进度单调不减。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskStateMachine {

    private final ConversationContextStore conversationContextStore;
    private final ProgressPublisher progressPublisher;
    private final RedisIdWorker redisIdWorker;
    private final MetricsRecorder metricsRecorder;
    private final Clock clock;

    private final Map<Long, TaskRecord> registry = new ConcurrentHashMap<>();

    /** conversationKey:requestId -> taskId */
    private final Map<String, Long> requestIndex = new ConcurrentHashMap<>();

    /**
     * 创建 pending 任务并发布初始快照。
     *
     * @throws InvalidRequestException 生成任务缺少必要槽位
     */
    public StartedTask start(TaskRequest request) {
        if (!StringUtils.hasText(request.getConversationKey())) {
            throw new InvalidRequestException("conversationKey 不能为空");
        }
        String dedupKey = StringUtils.hasText(request.getRequestId())
                ? request.getConversationKey() + ":" + request.getRequestId() : null;
        if (dedupKey != null) {
            Long existing = requestIndex.get(dedupKey);
            if (existing != null && registry.containsKey(existing)) {
                log.info("重复的任务请求: requestId={}, taskId={}", request.getRequestId(), existing);
                return new StartedTask(existing, true);
            }
        }
        if (request.getKind() == TaskKind.GENERATE) {
            List<SlotName> missing = RequiredSlots.missing(conversationContextStore.getSlots(request.getConversationKey()));
            if (!missing.isEmpty()) {
                throw new InvalidRequestException("缺少必要信息: " + missing);
            }
        }

        long now = clock.millis();
        TaskSnapshot snapshot = new TaskSnapshot();
        snapshot.setTaskId(redisIdWorker.nextId(RedisConstants.ID_TASK));
        snapshot.setKind(request.getKind());
        snapshot.setConversationKey(request.getConversationKey());
        snapshot.setStatus(TaskStatus.PENDING);
        snapshot.setProgress(0);
        snapshot.setMessage("任务已创建");
        snapshot.setCreatedAt(now);
        snapshot.setUpdatedAt(now);
        TaskRecord record = new TaskRecord(snapshot, dedupKey, System.nanoTime());

        registry.put(snapshot.getTaskId(), record);
        if (dedupKey != null) {
            Long raced = requestIndex.putIfAbsent(dedupKey, snapshot.getTaskId());
            if (raced != null && registry.containsKey(raced)) {
                registry.remove(snapshot.getTaskId());
                return new StartedTask(raced, true);
            }
            requestIndex.put(dedupKey, snapshot.getTaskId());
        }
        synchronized (record) {
            progressPublisher.publish(record.snapshot);
        }
        log.info("任务已创建: taskId={}, kind={}, conversationKey={}",
                snapshot.getTaskId(), request.getKind(), request.getConversationKey());
        return new StartedTask(snapshot.getTaskId(), false);
    }

    /**
     * mq 模式下消费端接管由其他实例创建的任务：按持久化快照在本地注册，已终态的任务不接管。
     *
     * @return 是否可以继续执行
     */
    public boolean adopt(TaskSnapshot snapshot) {
        if (snapshot == null || snapshot.getTaskId() == null || snapshot.isTerminal()) {
            return false;
        }
        TaskRecord existing = registry.putIfAbsent(snapshot.getTaskId(),
                new TaskRecord(snapshot.copy(), null, System.nanoTime()));
        if (existing == null) {
            log.info("接管任务: taskId={}, status={}", snapshot.getTaskId(), snapshot.getStatus());
            return true;
        }
        synchronized (existing) {
            return !existing.snapshot.isTerminal();
        }
    }

    public void advance(Long taskId, TaskStep step, double fraction, String message) {
        advance(taskId, step, fraction, message, null);
    }

    /**
     * 推进进度。终态任务、以及早于当前步骤的调用都是空操作。
     */
    public void advance(Long taskId, TaskStep step, double fraction, String message, List<SourceStatus> sources) {
        TaskRecord record = require(taskId);
        synchronized (record) {
            TaskSnapshot s = record.snapshot;
            if (s.isTerminal()) {
                return;
            }
            if (s.getStep() != null && step.ordinal() < s.getStep().ordinal()) {
                return;
            }
            if (s.getStatus() == TaskStatus.PENDING) {
                s.setStatus(TaskStatus.RUNNING);
            }
            s.setStep(step);
            s.setProgress(Math.max(s.getProgress(), step.progressAt(fraction)));
            if (message != null) {
                s.setMessage(message);
            }
            if (sources != null) {
                s.setSources(new ArrayList<>(sources));
            }
            s.setUpdatedAt(clock.millis());
            progressPublisher.publish(s);
        }
    }

    public void complete(Long taskId, Long versionId) {
        TaskRecord record = require(taskId);
        synchronized (record) {
            TaskSnapshot s = record.snapshot;
            if (s.isTerminal()) {
                return;
            }
            s.setStatus(TaskStatus.COMPLETED);
            s.setStep(TaskStep.FINALIZATION);
            s.setProgress(100);
            s.setResultVersionId(versionId);
            s.setMessage("行程已生成");
            terminate(record);
        }
    }

    public void fail(Long taskId, ErrorCode errorCode, boolean retryable, String message) {
        TaskRecord record = require(taskId);
        synchronized (record) {
            TaskSnapshot s = record.snapshot;
            if (s.isTerminal()) {
                return;
            }
            s.setStatus(TaskStatus.FAILED);
            s.setErrorCode(errorCode.name());
            s.setRetryable(retryable);
            s.setErrorMessage(message == null ? errorCode.getMsg() : message);
            s.setMessage(errorCode.getMsg());
            terminate(record);
        }
    }

    /**
     * pending 任务立即取消；running 任务只设置取消标记，由流水线在检查点确认。
     *
     * @return 取消请求后的快照
     */
    public TaskSnapshot cancel(Long taskId) {
        TaskRecord record = require(taskId);
        synchronized (record) {
            TaskSnapshot s = record.snapshot;
            if (s.isTerminal()) {
                return s.copy();
            }
            record.cancelRequested = true;
            if (s.getStatus() == TaskStatus.PENDING) {
                markCancelled(record);
            } else {
                log.info("已请求取消运行中的任务: taskId={}", taskId);
            }
            return s.copy();
        }
    }

    /**
     * 流水线观察到取消标记后调用。
     */
    public void confirmCancelled(Long taskId) {
        TaskRecord record = require(taskId);
        synchronized (record) {
            if (record.snapshot.isTerminal()) {
                return;
            }
            markCancelled(record);
        }
    }

    public boolean isCancellationRequested(Long taskId) {
        TaskRecord record = registry.get(taskId);
        return record == null || record.cancelRequested || record.snapshot.isTerminal();
    }

    /**
     * 步骤边界检查点：已请求取消或已终态时抛出 {@link TaskCancelledException}。
     */
    public void checkpoint(Long taskId) {
        if (isCancellationRequested(taskId)) {
            throw new TaskCancelledException(taskId);
        }
    }

    public TaskSnapshot snapshot(Long taskId) {
        TaskRecord record = require(taskId);
        synchronized (record) {
            return record.snapshot.copy();
        }
    }

    /**
     * 运行时间超过 staleMillis 仍未终态的任务 id。
     */
    public List<Long> staleTasks(long staleMillis) {
        long now = clock.millis();
        List<Long> stale = new ArrayList<>();
        registry.forEach((id, record) -> {
            synchronized (record) {
                if (!record.snapshot.isTerminal() && now - record.snapshot.getUpdatedAt() > staleMillis) {
                    stale.add(id);
                }
            }
        });
        return stale;
    }

    /**
     * 从内存注册表中移除终态时间超过 retentionMillis 的任务。
     *
     * @return 移除数量
     */
    public int evictTerminal(long retentionMillis) {
        long now = clock.millis();
        int evicted = 0;
        for (Map.Entry<Long, TaskRecord> e : registry.entrySet()) {
            TaskRecord record = e.getValue();
            boolean expired;
            synchronized (record) {
                expired = record.snapshot.isTerminal() && now - record.snapshot.getUpdatedAt() >= retentionMillis;
            }
            if (expired && registry.remove(e.getKey(), record)) {
                if (record.dedupKey != null) {
                    requestIndex.remove(record.dedupKey, e.getKey());
                }
                progressPublisher.evict(e.getKey());
                evicted++;
            }
        }
        return evicted;
    }

    public boolean isRegistered(Long taskId) {
        return taskId != null && registry.containsKey(taskId);
    }

    /**
     * 结束一个本进程没有登记、但持久化快照仍未终态的任务（例如执行它的进程已重启）。
     * 终态快照照常发布，等待中的订阅者因此被关闭。
     *
     * @return 发布的终态快照；任务已在本进程登记或已终态时返回 null
     */
    public TaskSnapshot failOrphan(TaskSnapshot stored, ErrorCode errorCode, String message) {
        if (stored == null || stored.isTerminal() || isRegistered(stored.getTaskId())) {
            return null;
        }
        TaskSnapshot s = stored.copy();
        s.setStatus(TaskStatus.FAILED);
        s.setErrorCode(errorCode.name());
        s.setRetryable(errorCode.isRetryable());
        s.setErrorMessage(message == null ? errorCode.getMsg() : message);
        s.setMessage(errorCode.getMsg());
        s.setUpdatedAt(clock.millis());
        progressPublisher.publish(s);
        progressPublisher.evict(s.getTaskId());
        String kind = s.getKind() == null ? null : s.getKind().name().toLowerCase();
        metricsRecorder.recordTaskTerminal(kind, s.getStatus().getCode(), s.getErrorCode());
        log.warn("孤儿任务已结束: taskId={}, lastStatus={}, lastUpdatedAt={}",
                s.getTaskId(), stored.getStatus(), stored.getUpdatedAt());
        return s;
    }

    private void markCancelled(TaskRecord record) {
        TaskSnapshot s = record.snapshot;
        s.setStatus(TaskStatus.CANCELLED);
        s.setErrorCode(ErrorCode.CANCELLED.name());
        s.setRetryable(false);
        s.setMessage(ErrorCode.CANCELLED.getMsg());
        terminate(record);
    }

    private void terminate(TaskRecord record) {
        TaskSnapshot s = record.snapshot;
        s.setUpdatedAt(clock.millis());
        progressPublisher.publish(s);
        String kind = s.getKind() == null ? null : s.getKind().name().toLowerCase();
        metricsRecorder.recordTaskTerminal(kind, s.getStatus().getCode(), s.getErrorCode());
        metricsRecorder.recordTaskDurationMs(kind, s.getStatus().getCode(),
                (System.nanoTime() - record.startedNanos) / 1_000_000L);
        log.info("任务结束: taskId={}, status={}, progress={}, errorCode={}",
                s.getTaskId(), s.getStatus().getCode(), s.getProgress(), s.getErrorCode());
    }

    private TaskRecord require(Long taskId) {
        TaskRecord record = taskId == null ? null : registry.get(taskId);
        if (record == null) {
            throw new UnknownTaskException("任务不存在: " + taskId);
        }
        return record;
    }

    private static final class TaskRecord {

        private final TaskSnapshot snapshot;
        private final String dedupKey;
        private final long startedNanos;
        private volatile boolean cancelRequested;

        TaskRecord(TaskSnapshot snapshot, String dedupKey, long startedNanos) {
            this.snapshot = snapshot;
            this.dedupKey = dedupKey;
            this.startedNanos = startedNanos;
        }
    }
}
