package com.tripflow.server.replan;

import com.tripflow.pojo.model.itinerary.ReplanKind;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * 判断一条聊天消息是否在修改已生成的行程，以及修改的类型。
 * <p>
 * 只做粗分类，具体改哪天、哪个活动由 {@link ReplanPlanner#resolveScope} 决定，
 * 范围不明确时由它抛出 AmbiguousModificationException。
 */
public final class ModificationDetector {

    private static final List<String> MODIFY_VERBS = Arrays.asList(
            "change", "swap", "replace", "instead", "modify", "switch", "换", "改", "替换", "调整");

    private static final List<String> HOTEL_WORDS = Arrays.asList("hotel", "accommodation", "酒店", "住宿");

    private static final List<String> ACTIVITY_WORDS = Arrays.asList("activity", "activities", "活动", "景点");

    private ModificationDetector() {
    }

    /**
     * @param slotsExtracted 本轮是否抽取到了出行槽位；只有修改动词、同时又更新了槽位的消息按槽位更新处理
     * @return 修改类型，不是修改请求时返回 null
     */
    public static ReplanKind detect(String message, boolean slotsExtracted) {
        if (!StringUtils.hasText(message)) {
            return null;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        boolean verb = containsAny(lower, MODIFY_VERBS);
        if (verb && containsAny(lower, HOTEL_WORDS)) {
            return ReplanKind.HOTEL_CHANGE;
        }
        // 只判断有没有提到某一天，越界由 resolveScope 处理
        if (!ReplanPlanner.daysMentioned(message, Integer.MAX_VALUE).isEmpty()) {
            return containsAny(lower, ACTIVITY_WORDS) ? ReplanKind.ACTIVITY_SWAP : ReplanKind.DAY_REPLAN;
        }
        if (verb && !slotsExtracted) {
            return ReplanKind.DAY_REPLAN;
        }
        return null;
    }

    private static boolean containsAny(String text, List<String> words) {
        return words.stream().anyMatch(text::contains);
    }
}
