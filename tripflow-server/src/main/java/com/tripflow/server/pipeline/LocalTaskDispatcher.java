package com.tripflow.server.pipeline;

import com.tripflow.server.task.TaskCommand;
import com.tripflow.server.task.TaskDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 默认分发方式：直接在本进程的编排线程池上执行。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "tripflow.planner", name = "dispatch", havingValue = "local", matchIfMissing = true)
public class LocalTaskDispatcher implements TaskDispatcher {

    private final ItineraryPipeline itineraryPipeline;

    @Override
    public void dispatch(TaskCommand command) {
        log.debug("本地分发任务: taskId={}, kind={}", command.getTaskId(), command.getKind());
        itineraryPipeline.run(command);
    }
}
