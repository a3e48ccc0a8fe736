package com.tripflow.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.common.properties.ProviderProperties;
import com.tripflow.pojo.model.payload.ProviderPayload;
import com.tripflow.pojo.model.source.GatherRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.CompletableFuture;

/**
 * 基于 JDK HttpClient 异步 JSON 调用的适配器基类。
 * 单次尝试，不重试；HTTP 状态码与解析错误都转换成 {@link ProviderException}。
 */
@Slf4j
public abstract class AbstractHttpProviderAdapter implements ProviderAdapter {

    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final ProviderProperties providerProperties;

    protected AbstractHttpProviderAdapter(HttpClient httpClient,
                                          ObjectMapper objectMapper,
                                          ProviderProperties providerProperties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.providerProperties = providerProperties;
    }

    protected abstract ProviderProperties.Settings settings();

    /**
     * 未配置 baseUrl 时使用的默认地址。
     */
    protected abstract String defaultBaseUrl();

    /**
     * 执行实际调用，可以发起多次 HTTP 请求再合并。
     */
    protected abstract CompletableFuture<? extends ProviderPayload> doFetch(GatherRequest request, Duration timeout);

    /**
     * 写入 payload.source 的服务名。
     */
    protected abstract String sourceName();

    @Override
    public boolean isConfigured() {
        ProviderProperties.Settings s = settings();
        return s != null && s.isEnabled() && StringUtils.hasText(s.getApiKey());
    }

    @Override
    public Duration timeout() {
        Long configured = settings() == null ? null : settings().getTimeoutMs();
        return Duration.ofMillis(configured != null && configured > 0 ? configured : type().getDefaultTimeoutMs());
    }

    @Override
    public CompletableFuture<ProviderPayload> fetch(GatherRequest request, Duration timeout) {
        CompletableFuture<? extends ProviderPayload> future;
        try {
            future = doFetch(request, timeout);
        } catch (ProviderException e) {
            return CompletableFuture.failedFuture(e);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                    new ProviderException(type(), FailureType.UNKNOWN, "构造请求失败: " + e.getMessage(), e));
        }
        return future.thenApply(payload -> {
            if (payload == null) {
                throw new ProviderException(type(), FailureType.INVALID_RESPONSE, "empty payload");
            }
            payload.setEstimated(false);
            payload.setSource(sourceName());
            payload.setConfidence(1.0);
            return (ProviderPayload) payload;
        });
    }

    /**
     * 发起 GET 请求并解析 JSON；非 2xx 与解析失败都以 ProviderException 结束。
     */
    protected CompletableFuture<JsonNode> getJson(URI uri, Duration timeout, Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        if (headers != null) {
            headers.forEach(builder::header);
        }
        return httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    int status = response.statusCode();
                    if (status / 100 != 2) {
                        log.warn("数据源返回非 2xx: provider={}, status={}", type().getCode(), status);
                        throw new ProviderException(type(), FailureType.ofHttpStatus(status), "http_" + status);
                    }
                    try {
                        return objectMapper.readTree(response.body());
                    } catch (Exception e) {
                        throw new ProviderException(type(), FailureType.INVALID_RESPONSE, "响应不是合法 JSON", e);
                    }
                });
    }

    protected String baseUrl() {
        String configured = settings() == null ? null : settings().getBaseUrl();
        String base = StringUtils.hasText(configured) ? configured : defaultBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    protected String option(String name, String defaultValue) {
        if (settings() == null || settings().getOptions() == null) {
            return defaultValue;
        }
        String v = settings().getOptions().get(name);
        return StringUtils.hasText(v) ? v : defaultValue;
    }

    protected static String query(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        params.forEach((k, v) -> {
            if (v != null) {
                joiner.add(URLEncoder.encode(k, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(v, StandardCharsets.UTF_8));
            }
        });
        return joiner.toString();
    }
}
