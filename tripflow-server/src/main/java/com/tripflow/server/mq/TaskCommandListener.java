package com.tripflow.server.mq;

import com.tripflow.common.exception.BaseException;
import com.tripflow.pojo.model.task.TaskSnapshot;
import com.tripflow.server.config.MqConfig;
import com.tripflow.server.pipeline.ItineraryPipeline;
import com.tripflow.server.progress.ProgressPublisher;
import com.tripflow.server.task.TaskCommand;
import com.tripflow.server.task.TaskStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 任务命令消费者：接管任务后交给流水线执行。
 * 非法消息拒绝且不重新入队，进入死信队列。
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "tripflow.planner", name = "dispatch", havingValue = "mq")
public class TaskCommandListener {

    private final TaskStateMachine taskStateMachine;
    private final ProgressPublisher progressPublisher;
    private final ItineraryPipeline itineraryPipeline;

    @RabbitListener(queues = MqConfig.TASK_QUEUE)
    public void handleTaskCommand(TaskCommand command) {
        if (command == null || command.getTaskId() == null || command.getKind() == null) {
            log.warn("非法的任务消息: {}", command);
            throw new AmqpRejectAndDontRequeueException("invalid task command");
        }
        TaskSnapshot snapshot;
        try {
            snapshot = progressPublisher.poll(command.getTaskId());
        } catch (BaseException e) {
            log.warn("任务快照不存在，丢弃消息: taskId={}, reason={}", command.getTaskId(), e.getMessage());
            throw new AmqpRejectAndDontRequeueException("unknown task " + command.getTaskId(), e);
        }
        if (!taskStateMachine.adopt(snapshot)) {
            log.info("任务已结束，跳过: taskId={}, status={}", command.getTaskId(), snapshot.getStatus());
            return;
        }
        // 流水线异步执行，join 让消息在任务结束后才确认
        itineraryPipeline.run(command).join();
    }
}
