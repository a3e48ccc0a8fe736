package com.tripflow.pojo.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;

/**
 * 数据源返回数据的公共父类，每种能力一个子类型。
 * estimated=true 表示整份数据由本地合成，客户端必须展示“估算”提示。
 */
@Data
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WeatherPayload.class, name = "weather"),
        @JsonSubTypes.Type(value = FlightPayload.class, name = "flights"),
        @JsonSubTypes.Type(value = HotelPayload.class, name = "hotels"),
        @JsonSubTypes.Type(value = TransitPayload.class, name = "transit"),
        @JsonSubTypes.Type(value = ImagePayload.class, name = "images")
})
public abstract class ProviderPayload {

    private boolean estimated;

    /** 数据来源标识：具体服务名，或 fallback */
    private String source;

    /** 数据可信度，真实数据为 1.0 */
    private double confidence = 1.0;

    /**
     * 整份数据及其中每一条记录是否都带有估算标记。
     */
    @JsonIgnore
    public abstract boolean isFullyLabelled();
}
