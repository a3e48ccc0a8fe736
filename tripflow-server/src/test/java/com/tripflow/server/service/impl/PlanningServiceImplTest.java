package com.tripflow.server.service.impl;

import com.tripflow.common.exception.BaseException;
import com.tripflow.common.exception.StorageUnavailableException;
import com.tripflow.common.exception.UnknownTaskException;
import com.tripflow.common.properties.PlannerProperties;
import com.tripflow.common.result.ErrorCode;
import com.tripflow.pojo.model.task.TaskKind;
import com.tripflow.pojo.model.task.TaskSnapshot;
import com.tripflow.pojo.model.task.TaskStatus;
import com.tripflow.server.limit.SimpleRateLimiter;
import com.tripflow.server.progress.ProgressPublisher;
import com.tripflow.server.task.StartedTask;
import com.tripflow.server.task.TaskDispatcher;
import com.tripflow.server.task.TaskRequest;
import com.tripflow.server.task.TaskStateMachine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * PlanningServiceImpl 的基础单元测试：
 * - 覆盖限流、重复请求、分发失败等分支；
 * - 覆盖已驱逐任务的取消。
 */
@ExtendWith(MockitoExtension.class)
class PlanningServiceImplTest {

    @Mock
    private TaskStateMachine taskStateMachine;

    @Mock
    private TaskDispatcher taskDispatcher;

    @Mock
    private ProgressPublisher progressPublisher;

    @Mock
    private SimpleRateLimiter simpleRateLimiter;

    @Spy
    private PlannerProperties plannerProperties = new PlannerProperties();

    @InjectMocks
    private PlanningServiceImpl planningService;

    private final TaskRequest request = TaskRequest.builder()
            .kind(TaskKind.GENERATE)
            .conversationKey("c1")
            .requestId("r1")
            .build();

    @Test
    void startShouldRejectWhenRateLimited() {
        when(simpleRateLimiter.tryAcquire(anyString(), eq("c1"), anyLong(), anyLong())).thenReturn(false);

        BaseException ex = assertThrows(BaseException.class, () -> planningService.start(request));

        assertEquals(ErrorCode.RATE_LIMITED, ex.getErrorCode());
        assertTrue(ex.isRetryable());
        verify(taskStateMachine, never()).start(any());
    }

    @Test
    void startShouldDispatchNewTask() {
        when(simpleRateLimiter.tryAcquire(anyString(), eq("c1"), anyLong(), anyLong())).thenReturn(true);
        when(taskStateMachine.start(request)).thenReturn(new StartedTask(42L, false));

        assertEquals(42L, planningService.start(request));
        verify(taskDispatcher).dispatch(argThat(cmd -> cmd.getTaskId().equals(42L) && cmd.getKind() == TaskKind.GENERATE));
    }

    @Test
    void startShouldNotDispatchDuplicate() {
        when(simpleRateLimiter.tryAcquire(anyString(), eq("c1"), anyLong(), anyLong())).thenReturn(true);
        when(taskStateMachine.start(request)).thenReturn(new StartedTask(42L, true));

        assertEquals(42L, planningService.start(request));
        verify(taskDispatcher, never()).dispatch(any());
    }

    @Test
    void startShouldFailTaskWhenDispatchFails() {
        when(simpleRateLimiter.tryAcquire(anyString(), eq("c1"), anyLong(), anyLong())).thenReturn(true);
        when(taskStateMachine.start(request)).thenReturn(new StartedTask(43L, false));
        doThrow(new StorageUnavailableException("mq down")).when(taskDispatcher).dispatch(any());

        assertThrows(StorageUnavailableException.class, () -> planningService.start(request));
        verify(taskStateMachine).fail(eq(43L), eq(ErrorCode.STORAGE_UNAVAILABLE), eq(true), anyString());
    }

    @Test
    void cancelOfEvictedTerminalTaskReturnsStoredSnapshot() {
        TaskSnapshot stored = new TaskSnapshot();
        stored.setTaskId(7L);
        stored.setStatus(TaskStatus.COMPLETED);
        when(taskStateMachine.cancel(7L)).thenThrow(new UnknownTaskException("任务不存在: 7"));
        when(progressPublisher.poll(7L)).thenReturn(stored);

        assertSame(stored, planningService.cancel(7L));
    }
}
