package com.tripflow.pojo.model.context;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单轮对话中抽取出的槽位。
 * explicit 表示用户在这一轮里明确提到了该槽位（例如“预算改成 3 万”），
 * 只有显式抽取才能覆盖高置信度的旧值。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedSlot {

    private SlotName name;

    private String value;

    private double confidence;

    private boolean explicit;

    public static ExtractedSlot explicit(SlotName name, String value, double confidence) {
        return new ExtractedSlot(name, value, confidence, true);
    }

    public static ExtractedSlot implicit(SlotName name, String value, double confidence) {
        return new ExtractedSlot(name, value, confidence, false);
    }
}
