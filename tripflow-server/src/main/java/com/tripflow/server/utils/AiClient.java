package com.tripflow.server.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.common.properties.AiProperties;
import com.tripflow.server.metrics.MetricsRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 极简 AI 客户端，用于调用 OpenAI 兼容的 Chat Completion 接口。
 * Minimal client for an OpenAI-compatible chat completion API.
 *
 * 只提供单一 chat 方法，JSON in/out，不引入 SDK。
 * 调用结果以 {@link AiReply} 返回，失败时带上错误类型，由上层决定降级还是失败。
 */
@Component
@Slf4j
public class AiClient {

    private final AiProperties aiProperties;
    private final ObjectMapper objectMapper;
    private final HttpClient aiHttpClient;
    private final MetricsRecorder metricsRecorder;

    public AiClient(AiProperties aiProperties,
                    ObjectMapper objectMapper,
                    @Qualifier("aiHttpClient") HttpClient aiHttpClient,
                    MetricsRecorder metricsRecorder) {
        this.aiProperties = aiProperties;
        this.objectMapper = objectMapper;
        this.aiHttpClient = aiHttpClient;
        this.metricsRecorder = metricsRecorder;
    }

    /**
     * 配置是否完整（地址、密钥、模型）。
     */
    public boolean isConfigured() {
        return StringUtils.hasText(aiProperties.getBaseUrl())
                && StringUtils.hasText(aiProperties.getApiKey())
                && StringUtils.hasText(aiProperties.getModel());
    }

    /**
     * 调用外部 AI 服务，传入 system + user prompt，返回纯文本回复内容。
     * Call AI provider with given system + user prompt.
     * 配置不完整时不发起调用，返回 errorType=config_missing。
     */
    public AiReply chat(String systemPrompt, String userPrompt) {
        String model = aiProperties.getModel();
        if (!isConfigured()) {
            log.warn("AI 配置不完整，跳过外部 LLM 调用");
            metricsRecorder.recordAiChatCall("skipped", "config_missing", model);
            return AiReply.fail(0, "config_missing");
        }

        long startNs = System.nanoTime();
        int promptBytes = safeBytes(systemPrompt) + safeBytes(userPrompt);
        int attempts = 0;
        try {
            int maxRetries = Math.max(0, aiProperties.getMaxRetries());
            int maxAttempts = 1 + maxRetries;
            AiReply last = AiReply.fail(0, "no_attempt");
            for (int i = 1; i <= maxAttempts; i++) {
                attempts = i;
                AiReply r = doHttpCall(systemPrompt, userPrompt);
                last = r;
                if (r.isSuccess()) {
                    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
                    metricsRecorder.recordAiChatLatencyMs(latencyMs, "success", model);
                    metricsRecorder.recordAiChatCall("success", "ok", model);
                    log.info("AI chat success: model={}, latencyMs={}, attempts={}, promptBytes={}, respBytes={}",
                            model, latencyMs, attempts, promptBytes, r.getResponseBytes());
                    return r;
                }

                if (!r.isRetryable() || i == maxAttempts) {
                    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
                    metricsRecorder.recordAiChatLatencyMs(latencyMs, "fail", model);
                    metricsRecorder.recordAiChatCall("fail", r.getErrorType(), model);
                    log.warn("AI chat fail: model={}, latencyMs={}, attempts={}, statusCode={}, errorType={}, promptBytes={}, respBytes={}",
                            model, latencyMs, attempts, r.getStatusCode(), r.getErrorType(), promptBytes, r.getResponseBytes());
                    return r;
                }
            }
            return last;
        } catch (Exception e) {
            metricsRecorder.recordAiChatCall("fail", "exception", model);
            log.error("调用外部 LLM 失败", e);
            return AiReply.fail(0, "exception");
        }
    }

    private AiReply doHttpCall(String systemPrompt, String userPrompt) {
        try {
            Map<String, Object> body = new HashMap<>();
            body.put("model", aiProperties.getModel());

            Map<String, String> sysMsg = new HashMap<>();
            sysMsg.put("role", "system");
            sysMsg.put("content", systemPrompt);

            Map<String, String> userMsg = new HashMap<>();
            userMsg.put("role", "user");
            userMsg.put("content", userPrompt);

            body.put("messages", List.of(sysMsg, userMsg));
            String json = objectMapper.writeValueAsString(body);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(aiProperties.getBaseUrl()))
                    .timeout(Duration.ofMillis(Math.max(1, aiProperties.getRequestTimeoutMs())))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + aiProperties.getApiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(json))
                    .build();

            HttpResponse<String> response = aiHttpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int code = response.statusCode();
            String respBody = response.body();
            int respBytes = safeBytes(respBody);

            if (code / 100 != 2 || !StringUtils.hasText(respBody)) {
                return AiReply.fail(code, "http_" + code, respBytes);
            }

            JsonNode root = objectMapper.readTree(respBody);
            JsonNode choices = root.get("choices");
            if (choices == null || !choices.isArray() || choices.isEmpty()) {
                return AiReply.fail(code, "bad_response_no_choices", respBytes);
            }
            JsonNode message = choices.get(0).get("message");
            if (message == null) {
                return AiReply.fail(code, "bad_response_no_message", respBytes);
            }
            JsonNode content = message.get("content");
            if (content == null || !StringUtils.hasText(content.asText())) {
                return AiReply.fail(code, "bad_response_empty_content", respBytes);
            }
            return AiReply.ok(content.asText().trim(), respBytes);
        } catch (HttpTimeoutException te) {
            return AiReply.fail(0, "timeout");
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return AiReply.fail(0, "interrupted");
        } catch (Exception e) {
            return AiReply.fail(0, "exception");
        }
    }

    private int safeBytes(String s) {
        if (!StringUtils.hasText(s)) {
            return 0;
        }
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * 一次 chat 调用的结果。
     */
    public static class AiReply {
        private final boolean success;
        private final String content;
        private final int statusCode;
        private final String errorType;
        private final int responseBytes;

        private AiReply(boolean success, String content, int statusCode, String errorType, int responseBytes) {
            this.success = success;
            this.content = content;
            this.statusCode = statusCode;
            this.errorType = errorType;
            this.responseBytes = responseBytes;
        }

        public static AiReply ok(String content, int responseBytes) {
            return new AiReply(true, content, 200, "ok", responseBytes);
        }

        public static AiReply fail(int statusCode, String errorType) {
            return new AiReply(false, null, statusCode, errorType, 0);
        }

        public static AiReply fail(int statusCode, String errorType, int responseBytes) {
            return new AiReply(false, null, statusCode, errorType, responseBytes);
        }

        public boolean isSuccess() {
            return success;
        }

        public String getContent() {
            return content;
        }

        public int getStatusCode() {
            return statusCode;
        }

        public String getErrorType() {
            return errorType;
        }

        public int getResponseBytes() {
            return responseBytes;
        }

        /**
         * 429 / 5xx / 超时视为瞬时错误。
         */
        public boolean isRetryable() {
            if ("timeout".equals(errorType)) {
                return true;
            }
            return statusCode == 429 || statusCode / 100 == 5;
        }
    }
}
