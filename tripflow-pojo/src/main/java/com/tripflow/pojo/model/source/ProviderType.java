package com.tripflow.pojo.model.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 外部数据源能力。新增数据源只需新增一个枚举值和对应的适配器。
 */
public enum ProviderType {

    WEATHER("weather", 5000L),
    FLIGHTS("flights", 10000L),
    HOTELS("hotels", 8000L),
    TRANSIT("transit", 5000L),
    IMAGES("images", 3000L);

    private final String code;

    /** 默认单次调用超时（毫秒），图片最短、机票最长 */
    private final long defaultTimeoutMs;

    ProviderType(String code, long defaultTimeoutMs) {
        this.code = code;
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public long getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    @JsonCreator
    public static ProviderType fromCode(String code) {
        for (ProviderType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown provider: " + code);
    }
}
