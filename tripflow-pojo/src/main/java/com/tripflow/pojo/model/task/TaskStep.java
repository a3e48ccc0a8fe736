package com.tripflow.pojo.model.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 固定的步骤序列，每一步对应一段进度区间。
 * 进度 = 区间起点 + 步内完成比例 * 区间长度，因此只要步骤不回退、比例不回退，进度就单调不减。
 */
public enum TaskStep {

    INTENT_EXTRACTION("intent_extraction", 5, 15),
    DATA_GATHERING("data_gathering", 15, 60),
    PLAN_COMPOSITION("plan_composition", 60, 90),
    FINALIZATION("finalization", 90, 100);

    private final String code;
    private final int from;
    private final int to;

    TaskStep(String code, int from, int to) {
        this.code = code;
        this.from = from;
        this.to = to;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    /**
     * @param fraction 步内完成比例，会被截断到 [0,1]
     */
    public int progressAt(double fraction) {
        double f = Double.isNaN(fraction) ? 0d : Math.max(0d, Math.min(1d, fraction));
        return from + (int) Math.floor((to - from) * f);
    }

    @JsonCreator
    public static TaskStep fromCode(String code) {
        for (TaskStep s : values()) {
            if (s.code.equalsIgnoreCase(code) || s.name().equalsIgnoreCase(code)) {
                return s;
            }
        }
        throw new IllegalArgumentException("unknown task step: " + code);
    }
}
