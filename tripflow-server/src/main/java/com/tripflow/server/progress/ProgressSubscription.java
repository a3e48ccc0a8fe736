package com.tripflow.server.progress;

import com.tripflow.pojo.model.task.TaskSnapshot;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 拉取式订阅：快照按发布顺序进入阻塞队列。
 */
public class ProgressSubscription implements ProgressListener, AutoCloseable {

    private final BlockingQueue<TaskSnapshot> queue = new LinkedBlockingQueue<>();

    private final Runnable unsubscribe;

    private volatile boolean closed;

    ProgressSubscription(Runnable unsubscribe) {
        this.unsubscribe = unsubscribe;
    }

    @Override
    public void onSnapshot(TaskSnapshot snapshot) {
        queue.offer(snapshot);
    }

    @Override
    public void onClose() {
        closed = true;
    }

    /**
     * 取下一条快照，超时返回 null。
     */
    public TaskSnapshot next(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * 频道已关闭且队列已取空。
     */
    public boolean isFinished() {
        return closed && queue.isEmpty();
    }

    @Override
    public void close() {
        closed = true;
        unsubscribe.run();
    }
}
