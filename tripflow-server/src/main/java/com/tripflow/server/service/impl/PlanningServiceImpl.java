package com.tripflow.server.service.impl;

import com.tripflow.common.exception.BaseException;
import com.tripflow.common.exception.UnknownTaskException;
import com.tripflow.common.properties.PlannerProperties;
import com.tripflow.common.result.ErrorCode;
import com.tripflow.pojo.model.task.TaskSnapshot;
import com.tripflow.server.limit.SimpleRateLimiter;
import com.tripflow.server.progress.ProgressPublisher;
import com.tripflow.server.service.PlanningService;
import com.tripflow.server.task.StartedTask;
import com.tripflow.server.task.TaskCommand;
import com.tripflow.server.task.TaskDispatcher;
import com.tripflow.server.task.TaskRequest;
import com.tripflow.server.task.TaskStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class PlanningServiceImpl implements PlanningService {

    private static final String LIMIT_BIZ_KEY = "task:start:conversation";

    private final TaskStateMachine taskStateMachine;
    private final TaskDispatcher taskDispatcher;
    private final ProgressPublisher progressPublisher;
    private final SimpleRateLimiter simpleRateLimiter;
    private final PlannerProperties plannerProperties;

    @Override
    public Long start(TaskRequest request) {
        boolean allowed = simpleRateLimiter.tryAcquire(LIMIT_BIZ_KEY, request.getConversationKey(),
                60, plannerProperties.getStartLimitPerMinute());
        if (!allowed) {
            log.warn("发起任务过于频繁: conversationKey={}", request.getConversationKey());
            throw new BaseException(ErrorCode.RATE_LIMITED);
        }
        StartedTask started = taskStateMachine.start(request);
        if (started.isDuplicate()) {
            return started.getTaskId();
        }
        try {
            taskDispatcher.dispatch(TaskCommand.of(started.getTaskId(), request));
        } catch (BaseException e) {
            taskStateMachine.fail(started.getTaskId(), e.getErrorCode(), e.isRetryable(), e.getMessage());
            throw e;
        }
        return started.getTaskId();
    }

    @Override
    public TaskSnapshot cancel(Long taskId) {
        try {
            return taskStateMachine.cancel(taskId);
        } catch (UnknownTaskException e) {
            // 已从内存驱逐的终态任务，取消是空操作
            TaskSnapshot stored = progressPublisher.poll(taskId);
            if (stored.isTerminal()) {
                return stored;
            }
            throw e;
        }
    }

    @Override
    public TaskSnapshot poll(Long taskId) {
        return progressPublisher.poll(taskId);
    }
}
