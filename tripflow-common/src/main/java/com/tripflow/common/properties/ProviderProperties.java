package com.tripflow.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * 外部数据源配置（天气、机票、酒店、交通、图片）。
 * External provider configuration, one entry per capability.
 */
@Data
@ConfigurationProperties(prefix = "tripflow.providers")
public class ProviderProperties {

    private Settings weather = new Settings();

    private Settings flights = new Settings();

    private Settings hotels = new Settings();

    private Settings transit = new Settings();

    private Settings images = new Settings();

    @Data
    public static class Settings {

        /**
         * 是否启用；关闭或缺少凭证时该数据源记为 missing，不会被调用。
         */
        private boolean enabled = true;

        private String apiKey;

        private String baseUrl;

        /**
         * 单次调用超时（毫秒）；为空时使用数据源默认值。
         */
        private Long timeoutMs;

        /**
         * 数据源特有参数，例如图片搜索的 cx、默认货币等。
         */
        private Map<String, String> options = new HashMap<>();
    }
}
