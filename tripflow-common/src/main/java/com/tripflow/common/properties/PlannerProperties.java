package com.tripflow.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 行程编排引擎配置。
 */
@Data
@ConfigurationProperties(prefix = "tripflow.planner")
public class PlannerProperties {

    /**
     * 单个任务的整体超时（毫秒），覆盖全部步骤；超时后任务以 TASK_TIMEOUT 失败且可重试。
     */
    private long taskTimeoutMs = 120_000L;

    /**
     * 单次数据采集中同时在途的数据源调用上限。
     */
    private int maxConcurrentProviders = 4;

    /**
     * 编排线程池核心线程数。
     */
    private int workerCoreSize = 4;

    /**
     * 编排线程池最大线程数。
     */
    private int workerMaxSize = 8;

    /**
     * 编排线程池队列容量。
     */
    private int workerQueueCapacity = 200;

    /**
     * 槽位置信度阈值：达到该值的槽位只能被显式指向它的新抽取覆盖。
     */
    private double slotConfidenceThreshold = 0.7;

    /**
     * LLM 编排失败时是否允许使用模板行程兜底。
     */
    private boolean allowTemplatePlan = true;

    /**
     * 任务分发方式：local（本地线程池）或 mq（RabbitMQ 队列）。
     */
    private String dispatch = "local";

    /**
     * 终态任务在内存注册表中的保留时间（分钟），之后只能通过持久化快照查询。
     */
    private long terminalRetentionMinutes = 10L;

    /**
     * 运行中任务多久没有更新视为僵死（分钟）。
     */
    private long staleTaskMinutes = 30L;

    /**
     * 单个会话每分钟允许发起的生成/重规划次数。
     */
    private long startLimitPerMinute = 10L;

    /**
     * 会话上下文写锁等待时间（毫秒）。
     */
    private long contextLockWaitMs = 2000L;

    /**
     * 用户未给出币种时使用的默认币种。
     */
    private String defaultCurrency = "THB";
}
