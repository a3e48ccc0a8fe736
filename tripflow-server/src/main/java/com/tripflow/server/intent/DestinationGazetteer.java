package com.tripflow.server.intent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 内置的常见目的地表：识别用户消息中的城市，并为机票估算、天气估算提供机场代码与气候带。
 * 不在表中的城市仍可由 LLM 抽取，只是估算数据会使用默认值。
 */
public final class DestinationGazetteer {

    private static final Map<String, Destination> BY_ALIAS = new LinkedHashMap<>();

    static {
        add("Tokyo", "Japan", "NRT", ClimateZone.TEMPERATE, false, "tokyo", "东京");
        add("Osaka", "Japan", "KIX", ClimateZone.TEMPERATE, false, "osaka", "大阪");
        add("Kyoto", "Japan", "KIX", ClimateZone.TEMPERATE, false, "kyoto", "京都");
        add("Bangkok", "Thailand", "BKK", ClimateZone.TROPICAL, false, "bangkok", "曼谷", "กรุงเทพ");
        add("Singapore", "Singapore", "SIN", ClimateZone.TROPICAL, false, "singapore", "新加坡");
        add("Hong Kong", "China", "HKG", ClimateZone.TROPICAL, false, "hong kong", "香港");
        add("Seoul", "South Korea", "ICN", ClimateZone.TEMPERATE, false, "seoul", "首尔");
        add("Taipei", "Taiwan", "TPE", ClimateZone.TROPICAL, false, "taipei", "台北");
        add("Kuala Lumpur", "Malaysia", "KUL", ClimateZone.TROPICAL, false, "kuala lumpur", "吉隆坡");
        add("Bali", "Indonesia", "DPS", ClimateZone.TROPICAL, true, "bali", "巴厘岛");
        add("Jakarta", "Indonesia", "CGK", ClimateZone.TROPICAL, true, "jakarta", "雅加达");
        add("Phuket", "Thailand", "HKT", ClimateZone.TROPICAL, false, "phuket", "普吉", "ภูเก็ต");
        add("Chiang Mai", "Thailand", "CNX", ClimateZone.TROPICAL, false, "chiang mai", "清迈", "เชียงใหม่");
        add("Paris", "France", "CDG", ClimateZone.TEMPERATE, false, "paris", "巴黎");
        add("London", "United Kingdom", "LHR", ClimateZone.TEMPERATE, false, "london", "伦敦");
        add("New York", "United States", "JFK", ClimateZone.TEMPERATE, false, "new york", "纽约");
        add("Los Angeles", "United States", "LAX", ClimateZone.TEMPERATE, false, "los angeles", "洛杉矶");
        add("San Francisco", "United States", "SFO", ClimateZone.TEMPERATE, false, "san francisco", "旧金山");
        add("Dubai", "United Arab Emirates", "DXB", ClimateZone.ARID, false, "dubai", "迪拜");
        add("Sydney", "Australia", "SYD", ClimateZone.TEMPERATE, true, "sydney", "悉尼");
        add("Melbourne", "Australia", "MEL", ClimateZone.TEMPERATE, true, "melbourne", "墨尔本");
    }

    private DestinationGazetteer() {
    }

    private static void add(String city, String country, String airport, ClimateZone climate,
                            boolean southern, String... aliases) {
        List<String> lower = new ArrayList<>();
        for (String a : aliases) {
            lower.add(a.toLowerCase(Locale.ROOT));
        }
        Destination d = new Destination(city, country, airport, climate, southern, Collections.unmodifiableList(lower));
        for (String a : lower) {
            BY_ALIAS.put(a, d);
        }
    }

    /**
     * 按名称或别名精确查找（忽略大小写），找不到返回 null。
     */
    public static Destination lookup(String name) {
        if (name == null) {
            return null;
        }
        return BY_ALIAS.get(name.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * 列出文本中出现的全部已知目的地及位置，按出现顺序。
     */
    public static List<Mention> mentions(String text) {
        List<Mention> result = new ArrayList<>();
        if (text == null) {
            return result;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Destination> e : BY_ALIAS.entrySet()) {
            int idx = lower.indexOf(e.getKey());
            while (idx >= 0) {
                result.add(new Mention(e.getValue(), idx, e.getKey().length()));
                idx = lower.indexOf(e.getKey(), idx + 1);
            }
        }
        result.sort((a, b) -> a.index != b.index
                ? Integer.compare(a.index, b.index)
                : Integer.compare(b.length, a.length));
        // 重叠的别名只保留先出现且更长的那个，例如“东京都”不算京都
        List<Mention> distinct = new ArrayList<>();
        int coveredUntil = -1;
        for (Mention m : result) {
            if (m.index >= coveredUntil) {
                distinct.add(m);
                coveredUntil = m.index + m.length;
            }
        }
        return distinct;
    }

    /**
     * 文本中一次目的地提及。
     */
    public static final class Mention {
        private final Destination destination;
        private final int index;
        private final int length;

        Mention(Destination destination, int index, int length) {
            this.destination = destination;
            this.index = index;
            this.length = length;
        }

        public Destination getDestination() {
            return destination;
        }

        public int getIndex() {
            return index;
        }

        public int getLength() {
            return length;
        }
    }
}
