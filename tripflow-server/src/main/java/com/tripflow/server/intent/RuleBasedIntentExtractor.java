package com.tripflow.server.intent;

import com.tripflow.pojo.model.context.ConversationContext;
import com.tripflow.pojo.model.context.ExtractedSlot;
import com.tripflow.pojo.model.context.SlotName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于规则的槽位抽取，LLM 不可用时的确定性兜底。
 *
 * <p>同一条消息里对同一个槽位出现多次不同的说法时（例如“预算 2 万……算了预算 3 万”），
 * 以最后一次提及为准。</p>
 */
@Component
@Slf4j
public class RuleBasedIntentExtractor implements IntentExtractor {

    static final double EXPLICIT_CONFIDENCE = 0.9;
    static final double KEYWORD_CONFIDENCE = 0.8;
    static final double GUESS_CONFIDENCE = 0.5;

    private static final Pattern BUDGET = Pattern.compile(
            "(?:budget|预算)\\s*(?:is|of|around|about|:|：|为|是|大概|约)?\\s*([0-9][0-9,]*(?:\\.[0-9]+)?)(?:\\s*(k|w|万|千)(?![a-z]))?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern AMOUNT_WITH_CURRENCY = Pattern.compile(
            "([0-9][0-9,]*)\\s*(baht|thb|usd|dollars|cny|rmb|元|泰铢|美元)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DURATION_DAYS = Pattern.compile(
            "(?<![0-9])(\\d{1,2})\\s*(?:-\\s*)?(?:days?|天|日游)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DURATION_NIGHTS = Pattern.compile(
            "(?<![0-9])(\\d{1,2})\\s*(?:nights?|晚)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DATE = Pattern.compile("(\\d{4}-\\d{2}-\\d{2})");
    private static final Pattern TRAVELERS = Pattern.compile(
            "(?<![0-9])(\\d{1,2})\\s*(?:people|persons|travell?ers|adults|pax|人|位)", Pattern.CASE_INSENSITIVE);
    private static final Pattern GUESSED_DESTINATION = Pattern.compile(
            "\\b(?:to|visit|visiting|in)\\s+([A-Z][a-z]+(?:\\s[A-Z][a-z]+)?)");

    private static final Map<String, String> TRAVELER_TYPES = new LinkedHashMap<>();
    private static final Map<String, String> INTERESTS = new LinkedHashMap<>();

    static {
        TRAVELER_TYPES.put("solo", "solo");
        TRAVELER_TYPES.put("alone", "solo");
        TRAVELER_TYPES.put("一个人", "solo");
        TRAVELER_TYPES.put("couple", "couple");
        TRAVELER_TYPES.put("honeymoon", "couple");
        TRAVELER_TYPES.put("情侣", "couple");
        TRAVELER_TYPES.put("蜜月", "couple");
        TRAVELER_TYPES.put("family", "family");
        TRAVELER_TYPES.put("kids", "family");
        TRAVELER_TYPES.put("家庭", "family");
        TRAVELER_TYPES.put("带孩子", "family");
        TRAVELER_TYPES.put("friends", "friends");
        TRAVELER_TYPES.put("朋友", "friends");
        TRAVELER_TYPES.put("business", "business");
        TRAVELER_TYPES.put("出差", "business");

        INTERESTS.put("beach", "beach");
        INTERESTS.put("海边", "beach");
        INTERESTS.put("海滩", "beach");
        INTERESTS.put("food", "food");
        INTERESTS.put("美食", "food");
        INTERESTS.put("shopping", "shopping");
        INTERESTS.put("购物", "shopping");
        INTERESTS.put("temple", "culture");
        INTERESTS.put("culture", "culture");
        INTERESTS.put("history", "culture");
        INTERESTS.put("文化", "culture");
        INTERESTS.put("寺庙", "culture");
        INTERESTS.put("nature", "nature");
        INTERESTS.put("hiking", "nature");
        INTERESTS.put("自然", "nature");
        INTERESTS.put("徒步", "nature");
        INTERESTS.put("nightlife", "nightlife");
        INTERESTS.put("夜生活", "nightlife");
        INTERESTS.put("diving", "diving");
        INTERESTS.put("潜水", "diving");
        INTERESTS.put("museum", "museum");
        INTERESTS.put("博物馆", "museum");
    }

    private final Clock clock;

    public RuleBasedIntentExtractor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<ExtractedSlot> extract(String message, ConversationContext context) {
        if (message == null || message.isBlank()) {
            return new ArrayList<>();
        }
        String lower = message.toLowerCase(Locale.ROOT);
        // 后写入的覆盖先写入的，实现“最后一次提及为准”
        Map<SlotName, ExtractedSlot> found = new EnumMap<>(SlotName.class);

        extractPlaces(message, found);
        extractBudget(message, found);
        extractDuration(message, found);
        extractDates(message, lower, found);
        extractTravelers(message, lower, found);
        extractInterests(lower, found);

        return new ArrayList<>(found.values());
    }

    private void extractPlaces(String message, Map<SlotName, ExtractedSlot> found) {
        List<DestinationGazetteer.Mention> mentions = DestinationGazetteer.mentions(message);
        String lower = message.toLowerCase(Locale.ROOT);
        DestinationGazetteer.Mention destination = null;
        for (DestinationGazetteer.Mention m : mentions) {
            if (isOrigin(lower, m.getIndex())) {
                found.put(SlotName.ORIGIN, ExtractedSlot.explicit(SlotName.ORIGIN,
                        m.getDestination().getCity(), KEYWORD_CONFIDENCE));
            } else {
                destination = m;
            }
        }
        if (destination != null) {
            found.put(SlotName.DESTINATION, ExtractedSlot.explicit(SlotName.DESTINATION,
                    destination.getDestination().getCity(), EXPLICIT_CONFIDENCE));
            return;
        }
        // 表外城市只能靠“to Xxx”猜测，置信度低于阈值，后续任何提及都可以覆盖
        Matcher m = GUESSED_DESTINATION.matcher(message);
        String guess = null;
        while (m.find()) {
            guess = m.group(1);
        }
        if (guess != null) {
            found.put(SlotName.DESTINATION, ExtractedSlot.implicit(SlotName.DESTINATION, guess, GUESS_CONFIDENCE));
        }
    }

    private boolean isOrigin(String lower, int index) {
        int windowStart = Math.max(0, index - 6);
        String before = lower.substring(windowStart, index);
        return before.contains("from ") || before.endsWith("从");
    }

    private void extractBudget(String message, Map<SlotName, ExtractedSlot> found) {
        String amount = null;
        Matcher m = BUDGET.matcher(message);
        while (m.find()) {
            amount = normalizeAmount(m.group(1), m.group(2));
        }
        if (amount == null) {
            Matcher c = AMOUNT_WITH_CURRENCY.matcher(message);
            while (c.find()) {
                amount = normalizeAmount(c.group(1), null);
            }
        }
        if (amount != null) {
            found.put(SlotName.BUDGET, ExtractedSlot.explicit(SlotName.BUDGET, amount, EXPLICIT_CONFIDENCE));
        }
    }

    private String normalizeAmount(String digits, String unit) {
        double value;
        try {
            value = Double.parseDouble(digits.replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
        if (unit != null) {
            switch (unit.toLowerCase(Locale.ROOT)) {
                case "k", "千" -> value *= 1_000;
                case "w", "万" -> value *= 10_000;
                default -> {
                }
            }
        }
        return String.valueOf(Math.round(value));
    }

    private void extractDuration(String message, Map<SlotName, ExtractedSlot> found) {
        Integer days = null;
        Matcher d = DURATION_DAYS.matcher(message);
        while (d.find()) {
            days = Integer.parseInt(d.group(1));
        }
        if (days == null) {
            Matcher n = DURATION_NIGHTS.matcher(message);
            while (n.find()) {
                days = Integer.parseInt(n.group(1)) + 1;
            }
        }
        if (days != null && days > 0 && days <= 30) {
            found.put(SlotName.DURATION_DAYS, ExtractedSlot.explicit(SlotName.DURATION_DAYS,
                    String.valueOf(days), EXPLICIT_CONFIDENCE));
        }
    }

    private void extractDates(String message, String lower, Map<SlotName, ExtractedSlot> found) {
        List<LocalDate> isoDates = new ArrayList<>();
        Matcher m = ISO_DATE.matcher(message);
        while (m.find()) {
            try {
                isoDates.add(LocalDate.parse(m.group(1)));
            } catch (DateTimeParseException e) {
                log.debug("忽略非法日期: {}", m.group(1));
            }
        }
        if (!isoDates.isEmpty()) {
            found.put(SlotName.START_DATE, ExtractedSlot.explicit(SlotName.START_DATE,
                    isoDates.get(0).toString(), EXPLICIT_CONFIDENCE));
            if (isoDates.size() > 1) {
                found.put(SlotName.END_DATE, ExtractedSlot.explicit(SlotName.END_DATE,
                        isoDates.get(isoDates.size() - 1).toString(), EXPLICIT_CONFIDENCE));
            }
            return;
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate relative = null;
        if (lower.contains("next week") || lower.contains("下周")) {
            relative = today.with(TemporalAdjusters.next(DayOfWeek.MONDAY));
        } else if (lower.contains("next month") || lower.contains("下个月")) {
            relative = today.with(TemporalAdjusters.firstDayOfNextMonth());
        } else if (lower.contains("this weekend") || lower.contains("周末")) {
            relative = today.with(TemporalAdjusters.nextOrSame(DayOfWeek.SATURDAY));
        } else if (lower.contains("tomorrow") || lower.contains("明天")) {
            relative = today.plusDays(1);
        }
        if (relative != null) {
            found.put(SlotName.START_DATE, ExtractedSlot.explicit(SlotName.START_DATE,
                    relative.toString(), KEYWORD_CONFIDENCE));
        }
    }

    private void extractTravelers(String message, String lower, Map<SlotName, ExtractedSlot> found) {
        String type = null;
        int typeIndex = -1;
        for (Map.Entry<String, String> e : TRAVELER_TYPES.entrySet()) {
            int idx = lower.lastIndexOf(e.getKey());
            if (idx > typeIndex) {
                typeIndex = idx;
                type = e.getValue();
            }
        }
        if (type != null) {
            found.put(SlotName.TRAVELER_TYPE, ExtractedSlot.explicit(SlotName.TRAVELER_TYPE, type, KEYWORD_CONFIDENCE));
        }
        Matcher m = TRAVELERS.matcher(message);
        String count = null;
        while (m.find()) {
            count = m.group(1);
        }
        if (count != null) {
            found.put(SlotName.TRAVELERS_COUNT, ExtractedSlot.explicit(SlotName.TRAVELERS_COUNT, count, EXPLICIT_CONFIDENCE));
        }
    }

    private void extractInterests(String lower, Map<SlotName, ExtractedSlot> found) {
        Set<String> interests = new LinkedHashSet<>();
        for (Map.Entry<String, String> e : INTERESTS.entrySet()) {
            if (lower.contains(e.getKey())) {
                interests.add(e.getValue());
            }
        }
        if (!interests.isEmpty()) {
            found.put(SlotName.INTERESTS, ExtractedSlot.explicit(SlotName.INTERESTS,
                    String.join(",", interests), KEYWORD_CONFIDENCE));
        }
    }
}
