package com.tripflow.pojo.model.source;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceOutcome {

    /** 真实数据 */
    OK("ok"),
    /** 调用失败，使用本地合成的估算数据 */
    FALLBACK("fallback"),
    /** 调用失败且没有任何数据 */
    ERROR("error"),
    /** 未配置或被跳过，没有发起调用 */
    MISSING("missing");

    private final String code;

    SourceOutcome(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
