package com.tripflow.server.progress;

import com.tripflow.common.exception.StorageUnavailableException;
import com.tripflow.common.exception.UnknownTaskException;
import com.tripflow.pojo.model.task.TaskSnapshot;
import com.tripflow.pojo.model.task.TaskStatus;
import com.tripflow.server.metrics.MetricsRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * ProgressPublisher 单元测试：
 * - 新订阅者先收到当前快照；
 * - 终态快照之后频道关闭；
 * - 持久化失败不影响在线订阅者；
 * - 已驱逐的终态任务被订阅时不重新建立频道。
 */
@ExtendWith(MockitoExtension.class)
class ProgressPublisherTest {

    @Mock
    private MetricsRecorder metricsRecorder;

    private InMemoryTaskSnapshotRepository repository;
    private ProgressPublisher publisher;

    @BeforeEach
    void setUp() {
        repository = new InMemoryTaskSnapshotRepository();
        publisher = new ProgressPublisher(repository, metricsRecorder);
    }

    @Test
    void lateSubscriberReceivesCurrentThenSubsequentSnapshots() throws Exception {
        publisher.publish(snapshot(1L, TaskStatus.PENDING, 0));
        publisher.publish(snapshot(1L, TaskStatus.RUNNING, 20));

        try (ProgressSubscription sub = publisher.subscribe(1L)) {
            assertEquals(20, sub.next(1, TimeUnit.SECONDS).getProgress());

            publisher.publish(snapshot(1L, TaskStatus.RUNNING, 55));
            publisher.publish(snapshot(1L, TaskStatus.COMPLETED, 100));

            assertEquals(55, sub.next(1, TimeUnit.SECONDS).getProgress());
            assertEquals(TaskStatus.COMPLETED, sub.next(1, TimeUnit.SECONDS).getStatus());
            assertTrue(sub.isFinished());
        }
    }

    @Test
    void snapshotsAfterTerminalAreDropped() throws Exception {
        publisher.publish(snapshot(2L, TaskStatus.RUNNING, 30));
        ProgressSubscription sub = publisher.subscribe(2L);
        sub.next(1, TimeUnit.SECONDS);

        publisher.publish(snapshot(2L, TaskStatus.CANCELLED, 30));
        publisher.publish(snapshot(2L, TaskStatus.RUNNING, 70));

        assertEquals(TaskStatus.CANCELLED, sub.next(1, TimeUnit.SECONDS).getStatus());
        assertNull(sub.next(50, TimeUnit.MILLISECONDS));
        assertEquals(TaskStatus.CANCELLED, publisher.poll(2L).getStatus());
    }

    @Test
    void subscribingToFinishedTaskClosesImmediately() throws Exception {
        publisher.publish(snapshot(3L, TaskStatus.FAILED, 40));

        ProgressSubscription sub = publisher.subscribe(3L);

        assertEquals(TaskStatus.FAILED, sub.next(1, TimeUnit.SECONDS).getStatus());
        assertTrue(sub.isFinished());
    }

    @Test
    void evictedTaskIsServedFromRepository() {
        publisher.publish(snapshot(4L, TaskStatus.COMPLETED, 100));
        publisher.evict(4L);

        assertEquals(TaskStatus.COMPLETED, publisher.poll(4L).getStatus());
        List<TaskSnapshot> received = new ArrayList<>();
        boolean[] closed = new boolean[1];
        publisher.subscribe(4L, new ProgressListener() {
            @Override
            public void onSnapshot(TaskSnapshot snapshot) {
                received.add(snapshot);
            }

            @Override
            public void onClose() {
                closed[0] = true;
            }
        });
        assertEquals(1, received.size());
        assertTrue(closed[0]);
    }

    @Test
    void subscribingToEvictedTerminalTasksLeavesNoChannelBehind() throws Exception {
        for (long id = 100; id < 150; id++) {
            publisher.publish(snapshot(id, TaskStatus.COMPLETED, 100));
            publisher.evict(id);
        }

        for (long id = 100; id < 150; id++) {
            try (ProgressSubscription sub = publisher.subscribe(id)) {
                assertEquals(TaskStatus.COMPLETED, sub.next(1, TimeUnit.SECONDS).getStatus());
                assertTrue(sub.isFinished());
            }
        }
        assertEquals(0, publisher.channelCount());
    }

    @Test
    void unknownTaskIsRejected() {
        assertThrows(UnknownTaskException.class, () -> publisher.poll(99L));
        assertThrows(UnknownTaskException.class, () -> publisher.subscribe(99L));
    }

    @Test
    void persistenceFailureStillDeliversToSubscribers() throws Exception {
        TaskSnapshotRepository failing = mock(TaskSnapshotRepository.class);
        doThrow(new StorageUnavailableException("redis down")).when(failing).save(any());
        ProgressPublisher fragile = new ProgressPublisher(failing, metricsRecorder);

        fragile.publish(snapshot(5L, TaskStatus.PENDING, 0));
        ProgressSubscription sub = fragile.subscribe(5L);
        fragile.publish(snapshot(5L, TaskStatus.RUNNING, 10));

        assertEquals(0, sub.next(1, TimeUnit.SECONDS).getProgress());
        assertEquals(10, sub.next(1, TimeUnit.SECONDS).getProgress());
        verify(metricsRecorder, times(2)).recordSnapshotPersistFailure();
    }

    @Test
    void failingListenerIsRemovedWithoutAffectingOthers() throws Exception {
        publisher.publish(snapshot(6L, TaskStatus.RUNNING, 10));
        ProgressSubscription healthy = publisher.subscribe(6L);
        int[] calls = new int[1];
        publisher.subscribe(6L, new ProgressListener() {
            @Override
            public void onSnapshot(TaskSnapshot snapshot) {
                calls[0]++;
                if (calls[0] > 1) {
                    throw new IllegalStateException("client gone");
                }
            }

            @Override
            public void onClose() {
            }
        });

        publisher.publish(snapshot(6L, TaskStatus.RUNNING, 20));
        publisher.publish(snapshot(6L, TaskStatus.RUNNING, 30));

        assertEquals(2, calls[0]);
        healthy.next(1, TimeUnit.SECONDS);
        healthy.next(1, TimeUnit.SECONDS);
        assertEquals(30, healthy.next(1, TimeUnit.SECONDS).getProgress());
    }

    private static TaskSnapshot snapshot(Long id, TaskStatus status, int progress) {
        TaskSnapshot s = new TaskSnapshot();
        s.setTaskId(id);
        s.setStatus(status);
        s.setProgress(progress);
        return s;
    }
}
