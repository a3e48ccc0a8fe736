package com.tripflow.server.mq;

import com.tripflow.common.exception.StorageUnavailableException;
import com.tripflow.server.config.MqConfig;
import com.tripflow.server.task.TaskCommand;
import com.tripflow.server.task.TaskDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * mq 分发：任务命令投递到 TRIPFLOW_TASK_QUEUE，由 {@link TaskCommandListener} 执行。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "tripflow.planner", name = "dispatch", havingValue = "mq")
public class MqTaskDispatcher implements TaskDispatcher {

    private final RabbitTemplate rabbitTemplate;

    @Override
    public void dispatch(TaskCommand command) {
        try {
            rabbitTemplate.convertAndSend(MqConfig.TASK_EXCHANGE, MqConfig.TASK_ROUTING_KEY, command);
            log.info("任务已投递到队列: taskId={}, kind={}", command.getTaskId(), command.getKind());
        } catch (AmqpException e) {
            log.error("任务投递失败: taskId={}", command.getTaskId(), e);
            throw new StorageUnavailableException("任务队列不可用", e);
        }
    }
}
