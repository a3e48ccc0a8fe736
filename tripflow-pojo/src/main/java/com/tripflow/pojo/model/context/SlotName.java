package com.tripflow.pojo.model.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 会话槽位名称。
 */
public enum SlotName {

    DESTINATION("destination"),
    ORIGIN("origin"),
    START_DATE("start_date"),
    END_DATE("end_date"),
    DURATION_DAYS("duration_days"),
    BUDGET("budget"),
    TRAVELER_TYPE("traveler_type"),
    TRAVELERS_COUNT("travelers_count"),
    INTERESTS("interests");

    private final String code;

    SlotName(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static SlotName fromCode(String code) {
        for (SlotName name : values()) {
            if (name.code.equalsIgnoreCase(code) || name.name().equalsIgnoreCase(code)) {
                return name;
            }
        }
        throw new IllegalArgumentException("unknown slot: " + code);
    }
}
