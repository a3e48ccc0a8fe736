package com.tripflow.server.progress;

import com.tripflow.common.exception.StorageUnavailableException;
import com.tripflow.common.exception.UnknownTaskException;
import com.tripflow.pojo.model.task.TaskSnapshot;
import com.tripflow.server.metrics.MetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 任务进度发布：每个任务一个频道，单生产者（状态机）多消费者。
 * <p>
 * 新订阅者先收到当前快照，再按发布顺序收到后续快照；终态快照发出后频道关闭。
 * 快照持久化失败只记日志和指标，不影响在线订阅者。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProgressPublisher {

    private final TaskSnapshotRepository taskSnapshotRepository;
    private final MetricsRecorder metricsRecorder;

    private final Map<Long, Channel> channels = new ConcurrentHashMap<>();

    public void publish(TaskSnapshot snapshot) {
        TaskSnapshot copy = snapshot.copy();
        try {
            taskSnapshotRepository.save(copy);
        } catch (StorageUnavailableException e) {
            log.warn("任务快照持久化失败: taskId={}, status={}", copy.getTaskId(), copy.getStatus(), e);
            metricsRecorder.recordSnapshotPersistFailure();
        }
        Channel channel = channels.computeIfAbsent(copy.getTaskId(), id -> new Channel());
        synchronized (channel) {
            if (channel.closed) {
                log.debug("频道已关闭，忽略快照: taskId={}", copy.getTaskId());
                return;
            }
            channel.latest = copy;
            channel.deliver(copy);
            if (copy.isTerminal()) {
                channel.close();
            }
        }
    }

    /**
     * 回调式订阅，SSE 推送使用。
     *
     * @throws UnknownTaskException 内存与持久化存储中都没有该任务
     */
    public void subscribe(Long taskId, ProgressListener listener) {
        Channel channel = channels.get(taskId);
        if (channel == null) {
            TaskSnapshot stored = loadQuietly(taskId);
            if (stored == null) {
                throw new UnknownTaskException("任务不存在: " + taskId);
            }
            if (stored.isTerminal()) {
                // 已结束的任务不再建立频道，送达终态快照后直接关闭
                if (safeDeliver(listener, stored)) {
                    safeClose(listener);
                }
                return;
            }
            // 本进程没有该任务的频道（由其他实例执行，或进程重启前的任务），终态由孤儿任务清理补发
            channel = channels.computeIfAbsent(taskId, id -> {
                Channel c = new Channel();
                c.latest = stored;
                return c;
            });
        }
        synchronized (channel) {
            if (channel.latest != null && !safeDeliver(listener, channel.latest)) {
                return;
            }
            if (channel.closed) {
                safeClose(listener);
                return;
            }
            channel.listeners.add(listener);
        }
    }

    /**
     * 拉取式订阅。
     */
    public ProgressSubscription subscribe(Long taskId) {
        ProgressSubscription[] holder = new ProgressSubscription[1];
        ProgressSubscription subscription = new ProgressSubscription(() -> unsubscribe(taskId, holder[0]));
        holder[0] = subscription;
        subscribe(taskId, subscription);
        return subscription;
    }

    public void unsubscribe(Long taskId, ProgressListener listener) {
        Channel channel = channels.get(taskId);
        if (channel == null) {
            return;
        }
        synchronized (channel) {
            channel.listeners.remove(listener);
        }
    }

    /**
     * 当前快照：优先本进程内存中的最新快照，其次持久化存储。
     */
    public TaskSnapshot poll(Long taskId) {
        Channel channel = channels.get(taskId);
        if (channel != null) {
            synchronized (channel) {
                if (channel.latest != null) {
                    return channel.latest.copy();
                }
            }
        }
        TaskSnapshot stored = taskSnapshotRepository.load(taskId);
        if (stored == null) {
            throw new UnknownTaskException("任务不存在: " + taskId);
        }
        return stored;
    }

    /**
     * 从内存中移除频道，之后只能通过持久化快照查询。
     */
    public void evict(Long taskId) {
        Channel channel = channels.remove(taskId);
        if (channel != null) {
            synchronized (channel) {
                channel.close();
            }
        }
    }

    int channelCount() {
        return channels.size();
    }

    private TaskSnapshot loadQuietly(Long taskId) {
        try {
            return taskSnapshotRepository.load(taskId);
        } catch (StorageUnavailableException e) {
            log.warn("读取任务快照失败: taskId={}", taskId, e);
            return null;
        }
    }

    private static boolean safeDeliver(ProgressListener listener, TaskSnapshot snapshot) {
        try {
            listener.onSnapshot(snapshot.copy());
            return true;
        } catch (RuntimeException e) {
            log.warn("订阅者处理快照失败，移除该订阅者: taskId={}", snapshot.getTaskId(), e);
            return false;
        }
    }

    private static void safeClose(ProgressListener listener) {
        try {
            listener.onClose();
        } catch (RuntimeException e) {
            log.debug("订阅者关闭回调异常: {}", e.getMessage());
        }
    }

    private static final class Channel {

        private TaskSnapshot latest;
        private boolean closed;
        private final List<ProgressListener> listeners = new ArrayList<>();

        void deliver(TaskSnapshot snapshot) {
            listeners.removeIf(l -> !safeDeliver(l, snapshot));
        }

        void close() {
            closed = true;
            for (ProgressListener l : listeners) {
                safeClose(l);
            }
            listeners.clear();
        }
    }
}
