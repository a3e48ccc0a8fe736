package com.tripflow.server.intent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.pojo.model.context.ConversationContext;
import com.tripflow.pojo.model.context.ExtractedSlot;
import com.tripflow.pojo.model.context.SlotName;
import com.tripflow.server.utils.AiClient;
import com.tripflow.server.utils.JsonBlocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 使用 LLM 抽取槽位；LLM 未配置、调用失败或输出无法解析时退回规则抽取。
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmIntentExtractor implements IntentExtractor {

    private static final String SYSTEM_PROMPT = "You extract travel planning slots from ONE user message. "
            + "Return ONLY a JSON object: {\"slots\":[{\"name\":...,\"value\":...,\"confidence\":0-1,\"explicit\":true|false}]}. "
            + "Allowed names: destination, origin, start_date, end_date, duration_days, budget, traveler_type, "
            + "travelers_count, interests. Dates must be ISO yyyy-MM-dd, budget a plain integer amount, "
            + "interests a comma separated list. explicit=true only when the user directly states that slot in this message. "
            + "If the same slot is stated several times, keep the last statement. Omit slots that are not mentioned.";

    private final AiClient aiClient;
    private final RuleBasedIntentExtractor ruleBasedIntentExtractor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public List<ExtractedSlot> extract(String message, ConversationContext context) {
        if (!StringUtils.hasText(message)) {
            return new ArrayList<>();
        }
        if (!aiClient.isConfigured()) {
            return ruleBasedIntentExtractor.extract(message, context);
        }
        AiClient.AiReply reply = aiClient.chat(SYSTEM_PROMPT, buildUserPrompt(message, context));
        if (!reply.isSuccess()) {
            log.info("LLM 槽位抽取失败，使用规则抽取: errorType={}", reply.getErrorType());
            return ruleBasedIntentExtractor.extract(message, context);
        }
        List<ExtractedSlot> parsed = parse(reply.getContent());
        if (parsed == null) {
            log.warn("LLM 槽位抽取结果无法解析，使用规则抽取");
            return ruleBasedIntentExtractor.extract(message, context);
        }
        return parsed;
    }

    private String buildUserPrompt(String message, ConversationContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("Today is ").append(LocalDate.now(clock)).append(".\n");
        if (context != null && !context.getSlots().isEmpty()) {
            sb.append("Known slots: ");
            for (Map.Entry<SlotName, String> e : context.slotValues().entrySet()) {
                sb.append(e.getKey().getCode()).append('=').append(e.getValue()).append("; ");
            }
            sb.append('\n');
        }
        sb.append("Message: ").append(message);
        return sb.toString();
    }

    /**
     * 解析 LLM 输出；格式不对返回 null。允许输出被 ```json 代码块包裹。
     */
    List<ExtractedSlot> parse(String content) {
        String json = JsonBlocks.strip(content);
        try {
            JsonNode root = objectMapper.readTree(json);
            JsonNode slots = root.get("slots");
            if (slots == null || !slots.isArray()) {
                return null;
            }
            List<ExtractedSlot> result = new ArrayList<>();
            for (JsonNode node : slots) {
                String name = node.path("name").asText(null);
                String value = node.path("value").asText(null);
                if (!StringUtils.hasText(name) || !StringUtils.hasText(value)) {
                    continue;
                }
                SlotName slotName;
                try {
                    slotName = SlotName.fromCode(name);
                } catch (IllegalArgumentException e) {
                    log.debug("忽略未知槽位: {}", name);
                    continue;
                }
                double confidence = Math.max(0d, Math.min(1d, node.path("confidence").asDouble(0.5)));
                boolean explicit = node.path("explicit").asBoolean(false);
                result.add(new ExtractedSlot(slotName, value.trim(), confidence, explicit));
            }
            return result;
        } catch (Exception e) {
            log.debug("解析 LLM 槽位输出失败: {}", e.getMessage());
            return null;
        }
    }
}
