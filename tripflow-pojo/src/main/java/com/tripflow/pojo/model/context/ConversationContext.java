package com.tripflow.pojo.model.context;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 会话上下文：有序的对话轮次 + 槽位集合。
 * Conversation context, keyed by conversation key.
 */
@Data
@NoArgsConstructor
public class ConversationContext {

    private String key;

    private List<Turn> turns = new ArrayList<>();

    private Map<SlotName, SlotValue> slots = new EnumMap<>(SlotName.class);

    /** 该会话最近一次生成的行程版本 */
    private Long lastVersionId;

    private long createdAt;

    private long updatedAt;

    public ConversationContext(String key, long now) {
        this.key = key;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public boolean hasTurn(String turnId) {
        if (turnId == null) {
            return false;
        }
        for (Turn turn : turns) {
            if (Objects.equals(turnId, turn.getTurnId())) {
                return true;
            }
        }
        return false;
    }

    public String slotValue(SlotName name) {
        SlotValue v = slots.get(name);
        return v == null ? null : v.getValue();
    }

    /**
     * 槽位名到值的副本，不含置信度等元信息。
     */
    public Map<SlotName, String> slotValues() {
        Map<SlotName, String> values = new EnumMap<>(SlotName.class);
        slots.forEach((k, v) -> values.put(k, v.getValue()));
        return values;
    }
}
