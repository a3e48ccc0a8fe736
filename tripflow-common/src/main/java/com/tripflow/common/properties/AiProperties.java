package com.tripflow.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * AI 配置属性（如 OpenAI 兼容接口的地址、密钥、模型等）。
 * AI provider configuration (e.g. OpenAI compatible API).
 */
@Data
@ConfigurationProperties(prefix = "tripflow.ai")
public class AiProperties {

    /**
     * Chat Completion 接口的基础 URL，例如：https://api.openai.com/v1/chat/completions
     * Base URL of chat completion endpoint, e.g. https://api.openai.com/v1/chat/completions
     */
    private String baseUrl;

    /**
     * AI 服务提供方的 API Key。
     * API key for the AI provider.
     */
    private String apiKey;

    /**
     * 模型名称，例如：gpt-4.1-mini。
     * Model name, e.g. gpt-4.1-mini.
     */
    private String model;

    /**
     * 连接超时（毫秒）。
     */
    private int connectTimeoutMs = 1000;

    /**
     * 单次请求超时（毫秒）。行程编排输出较长，默认比普通对话更宽松。
     */
    private int requestTimeoutMs = 30000;

    /**
     * 最大重试次数（不含首次请求）。
     * 默认不重试：失败交给任务级别的 retryable 标记，由传输层决定是否重试。
     */
    private int maxRetries = 0;
}
