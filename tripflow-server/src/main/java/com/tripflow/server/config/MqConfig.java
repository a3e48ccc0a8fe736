package com.tripflow.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * 任务分发使用 RabbitMQ 时的队列拓扑，仅在 tripflow.planner.dispatch=mq 时生效。
 */
@Configuration
@ConditionalOnProperty(prefix = "tripflow.planner", name = "dispatch", havingValue = "mq")
public class MqConfig {

    public static final String TASK_EXCHANGE = "TRIPFLOW_EXCHANGE";
    public static final String TASK_DL_EXCHANGE = "TRIPFLOW_DL_EXCHANGE";
    public static final String TASK_QUEUE = "TRIPFLOW_TASK_QUEUE";
    public static final String TASK_DLQ = "TRIPFLOW_TASK_DLQ";
    public static final String TASK_ROUTING_KEY = "task";
    public static final String TASK_DL_ROUTING_KEY = "task.dlq";

    @Bean
    public DirectExchange taskExchange() {
        return new DirectExchange(TASK_EXCHANGE);
    }

    @Bean
    public DirectExchange taskDlExchange() {
        return new DirectExchange(TASK_DL_EXCHANGE);
    }

    @Bean
    public Queue taskQueue() {
        Map<String, Object> args = new HashMap<>();
        args.put("x-dead-letter-exchange", TASK_DL_EXCHANGE);
        args.put("x-dead-letter-routing-key", TASK_DL_ROUTING_KEY);
        return QueueBuilder.durable(TASK_QUEUE)
                .withArguments(args)
                .build();
    }

    @Bean
    public Queue taskDlq() {
        return QueueBuilder.durable(TASK_DLQ).build();
    }

    @Bean
    public Binding bindTaskQueue(Queue taskQueue, DirectExchange taskExchange) {
        return BindingBuilder.bind(taskQueue).to(taskExchange).with(TASK_ROUTING_KEY);
    }

    @Bean
    public Binding bindTaskDlq(Queue taskDlq, DirectExchange taskDlExchange) {
        return BindingBuilder.bind(taskDlq).to(taskDlExchange).with(TASK_DL_ROUTING_KEY);
    }

    @Bean
    public MessageConverter taskMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }
}
