package com.tripflow.server.config;

import com.tripflow.common.properties.AiProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * 外部 HTTP 客户端配置：
 * - 使用 JDK 17 自带 HttpClient（连接复用 + 低依赖）
 * - LLM 与数据源分别使用独立的客户端，互不占用连接
 * - 单次请求超时在各自的 HttpRequest 上设置
 */
@Configuration
@RequiredArgsConstructor
public class AiHttpClientConfig {

    private static final long PROVIDER_CONNECT_TIMEOUT_MS = 2000L;

    private final AiProperties aiProperties;

    @Bean
    public HttpClient aiHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(aiProperties.getConnectTimeoutMs()))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    public HttpClient providerHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(PROVIDER_CONNECT_TIMEOUT_MS))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
