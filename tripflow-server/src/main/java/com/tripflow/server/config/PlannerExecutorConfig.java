package com.tripflow.server.config;

import com.tripflow.common.properties.PlannerProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 编排线程池：所有任务的步骤在这个有界线程池上复用执行，不为单个任务独占线程。
 * 提交时复制 MDC，保证异步步骤里的日志仍带 traceId / taskId。
 */
@Configuration
@RequiredArgsConstructor
public class PlannerExecutorConfig {

    private final PlannerProperties plannerProperties;

    @Bean
    public ThreadPoolTaskExecutor plannerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(plannerProperties.getWorkerCoreSize());
        executor.setMaxPoolSize(Math.max(plannerProperties.getWorkerCoreSize(), plannerProperties.getWorkerMaxSize()));
        executor.setQueueCapacity(plannerProperties.getWorkerQueueCapacity());
        executor.setThreadNamePrefix("planner-");
        // 队列满时由提交线程执行，起到背压作用
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setTaskDecorator(runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
