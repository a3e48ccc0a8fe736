package com.tripflow.server.intent;

import lombok.Value;

import java.util.List;

/**
 * 内置目的地条目。
 */
@Value
public class Destination {

    /** 展示名，例如 Phuket */
    String city;

    String country;

    /** 主要机场 IATA 代码 */
    String airportCode;

    ClimateZone climate;

    boolean southernHemisphere;

    /** 小写别名（英文、中文、泰文等） */
    List<String> aliases;
}
