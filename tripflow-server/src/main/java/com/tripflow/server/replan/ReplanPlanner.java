package com.tripflow.server.replan;

import com.tripflow.common.exception.AmbiguousModificationException;
import com.tripflow.common.exception.InvalidRequestException;
import com.tripflow.pojo.dto.ReplanRequestDTO;
import com.tripflow.pojo.model.context.ResolvedTrip;
import com.tripflow.pojo.model.context.SlotName;
import com.tripflow.pojo.model.context.SlotValue;
import com.tripflow.pojo.model.itinerary.Activity;
import com.tripflow.pojo.model.itinerary.DayPlan;
import com.tripflow.pojo.model.itinerary.ItineraryVersion;
import com.tripflow.pojo.model.itinerary.ReplanKind;
import com.tripflow.pojo.model.payload.HotelPayload;
import com.tripflow.pojo.model.source.GatherResult;
import com.tripflow.pojo.model.source.ProviderType;
import com.tripflow.pojo.model.source.SourceState;
import com.tripflow.pojo.model.source.SourceStatus;
import com.tripflow.server.pipeline.ItineraryAssembler;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 重规划的纯逻辑部分：范围解析、需要重新采集的数据源、新旧版本合并。
 */
@Component
public class ReplanPlanner {

    private static final Pattern DAY_EN = Pattern.compile("\\bday\\s*(\\d{1,2})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DAY_ORDINAL_EN = Pattern.compile(
            "\\b(first|second|third|fourth|fifth|sixth|seventh|last)\\s+day\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DAY_ZH = Pattern.compile("第\\s*(\\d{1,2}|[一二三四五六七八九十])\\s*天");
    private static final List<String> ORDINALS_EN = Arrays.asList("first", "second", "third", "fourth", "fifth", "sixth", "seventh");
    private static final String ZH_DIGITS = "一二三四五六七八九十";

    /**
     * @throws InvalidRequestException        显式给出的天数或活动不存在
     * @throws AmbiguousModificationException 无法从请求中确定修改范围
     */
    public ReplanScope resolveScope(ItineraryVersion parent, ReplanRequestDTO modification) {
        if (modification == null || modification.getKind() == null) {
            throw new InvalidRequestException("缺少修改类型");
        }
        ReplanKind kind = modification.getKind();
        String instruction = modification.getInstruction();
        if (kind == ReplanKind.HOTEL_CHANGE) {
            return new ReplanScope(kind, new TreeSet<>(), Collections.emptySet(), instruction);
        }

        TreeSet<Integer> days = new TreeSet<>();
        Set<String> activityIds = new LinkedHashSet<>();
        if (modification.getActivityIds() != null && !modification.getActivityIds().isEmpty()) {
            for (String id : modification.getActivityIds()) {
                int day = parent.dayOfActivity(id);
                if (day < 0) {
                    throw new InvalidRequestException("活动不存在: " + id);
                }
                days.add(day);
                activityIds.add(id);
            }
        }
        if (modification.getDayNumbers() != null && !modification.getDayNumbers().isEmpty()) {
            for (Integer n : modification.getDayNumbers()) {
                if (n == null || parent.dayByNumber(n) == null) {
                    throw new InvalidRequestException("天数不存在: " + n);
                }
                days.add(n);
            }
        }
        if (days.isEmpty()) {
            days.addAll(daysMentioned(instruction, parent.getDays().size()));
        }
        if (days.isEmpty()) {
            throw new AmbiguousModificationException();
        }

        if (kind == ReplanKind.ACTIVITY_SWAP && activityIds.isEmpty()) {
            activityIds.addAll(activitiesMentioned(parent, days, instruction));
            if (activityIds.isEmpty()) {
                throw new AmbiguousModificationException("请说明要替换第" + days.first() + "天的哪个活动");
            }
        }
        return new ReplanScope(kind, days, activityIds, instruction);
    }

    /**
     * 从自由文本中找出 "day 2" / "第二天" / "last day" 这类引用，超出范围的忽略。
     */
    static Set<Integer> daysMentioned(String instruction, int totalDays) {
        Set<Integer> days = new TreeSet<>();
        if (!StringUtils.hasText(instruction)) {
            return days;
        }
        Matcher en = DAY_EN.matcher(instruction);
        while (en.find()) {
            days.add(Integer.parseInt(en.group(1)));
        }
        Matcher ord = DAY_ORDINAL_EN.matcher(instruction);
        while (ord.find()) {
            String word = ord.group(1).toLowerCase(Locale.ROOT);
            days.add("last".equals(word) ? totalDays : ORDINALS_EN.indexOf(word) + 1);
        }
        Matcher zh = DAY_ZH.matcher(instruction);
        while (zh.find()) {
            String g = zh.group(1);
            int idx = ZH_DIGITS.indexOf(g);
            days.add(idx >= 0 ? idx + 1 : Integer.parseInt(g));
        }
        if (instruction.contains("最后一天")) {
            days.add(totalDays);
        }
        days.removeIf(d -> d < 1 || d > totalDays);
        return days;
    }

    private static Set<String> activitiesMentioned(ItineraryVersion parent, Set<Integer> days, String instruction) {
        Set<String> ids = new LinkedHashSet<>();
        if (!StringUtils.hasText(instruction)) {
            return ids;
        }
        String lower = instruction.toLowerCase(Locale.ROOT);
        for (Integer n : days) {
            for (Activity a : parent.dayByNumber(n).getActivities()) {
                if (StringUtils.hasText(a.getTitle()) && lower.contains(a.getTitle().toLowerCase(Locale.ROOT))) {
                    ids.add(a.getActivityId());
                }
            }
        }
        return ids;
    }

    public Set<ProviderType> relevantSources(ReplanKind kind) {
        return switch (kind) {
            case ACTIVITY_SWAP -> EnumSet.of(ProviderType.IMAGES, ProviderType.TRANSIT);
            case DAY_REPLAN -> EnumSet.of(ProviderType.WEATHER, ProviderType.TRANSIT, ProviderType.IMAGES);
            case HOTEL_CHANGE -> EnumSet.of(ProviderType.HOTELS);
        };
    }

    /**
     * 父版本的出行参数，会话中仍有的槽位（预算、兴趣、人数）一并带上。
     */
    public ResolvedTrip tripOf(ItineraryVersion parent, Map<SlotName, SlotValue> slots, String defaultCurrency) {
        ResolvedTrip.ResolvedTripBuilder builder = ResolvedTrip.builder()
                .destination(parent.getDestination())
                .startDate(parent.getStartDate())
                .endDate(parent.getEndDate())
                .currency(defaultCurrency)
                .travelers(1);
        if (slots == null) {
            return builder.build();
        }
        SlotValue origin = slots.get(SlotName.ORIGIN);
        if (origin != null) {
            builder.origin(origin.getValue());
        }
        SlotValue type = slots.get(SlotName.TRAVELER_TYPE);
        if (type != null) {
            builder.travelerType(type.getValue());
        }
        SlotValue budget = slots.get(SlotName.BUDGET);
        if (budget != null && budget.getValue() != null && budget.getValue().matches("\\d+")) {
            builder.budget(Long.parseLong(budget.getValue()));
        }
        SlotValue count = slots.get(SlotName.TRAVELERS_COUNT);
        if (count != null && count.getValue() != null && count.getValue().matches("\\d+")) {
            builder.travelers(Math.max(1, Integer.parseInt(count.getValue())));
        }
        SlotValue interests = slots.get(SlotName.INTERESTS);
        if (interests != null && StringUtils.hasText(interests.getValue())) {
            for (String i : interests.getValue().split("[,，]")) {
                if (StringUtils.hasText(i)) {
                    builder.interest(i.trim());
                }
            }
        }
        return builder.build();
    }

    /**
     * 地点列表，用于交通数据采集：范围内各天活动的地点，按顺序去重。
     */
    public List<String> placesOf(ItineraryVersion parent, ReplanScope scope) {
        Set<String> places = new LinkedHashSet<>();
        for (Integer n : scope.getDays()) {
            for (Activity a : parent.dayByNumber(n).getActivities()) {
                if (StringUtils.hasText(a.getLocation())) {
                    places.add(a.getLocation());
                }
            }
        }
        return new ArrayList<>(places);
    }

    /**
     * 合并出新版本：不在范围内的天直接引用父版本的 DayPlan 对象；
     * ACTIVITY_SWAP 只替换目标活动，同一天的其他活动保持不变。
     *
     * @param composedDays 已组装好的新天（按天数索引），HOTEL_CHANGE 时为空
     */
    public ItineraryVersion merge(ItineraryVersion parent, ReplanScope scope,
                                  Map<Integer, DayPlan> composedDays, GatherResult gathered) {
        List<DayPlan> days = new ArrayList<>();
        boolean templatePlan = parent.isTemplatePlan();
        for (DayPlan original : parent.getDays()) {
            DayPlan composed = composedDays.get(original.getDayNumber());
            if (composed == null || !scope.getDays().contains(original.getDayNumber())) {
                days.add(original);
                continue;
            }
            DayPlan replaced = scope.getKind() == ReplanKind.ACTIVITY_SWAP
                    ? swapActivities(original, composed, scope.getActivityIds())
                    : composed;
            templatePlan = templatePlan || replaced.isTemplatePlan();
            days.add(replaced);
        }

        ItineraryVersion.ItineraryVersionBuilder builder = parent.toBuilder()
                .versionId(null)
                .versionNumber(0)
                .parentVersionId(parent.getVersionId())
                .clearDays()
                .days(days)
                .templatePlan(templatePlan)
                .modificationSummary(scope.summary());

        HotelPayload hotels = gathered.payload(ProviderType.HOTELS, HotelPayload.class);
        if (scope.getKind() == ReplanKind.HOTEL_CHANGE && hotels != null) {
            builder.clearHotels().hotels(hotels.getHotels());
        }

        List<SourceStatus> sources = mergeSources(parent.getSources(), gathered);
        builder.clearSources().sources(sources);
        builder.degraded(sources.stream().anyMatch(s -> s.getStatus() != SourceState.ACTIVE));
        return builder.build();
    }

    private static DayPlan swapActivities(DayPlan original, DayPlan composed, Set<String> targets) {
        List<Activity> replacements = composed.getActivities();
        if (replacements.isEmpty()) {
            return original;
        }
        DayPlan.DayPlanBuilder day = original.toBuilder().clearActivities();
        List<Activity> activities = original.getActivities();
        int k = 0;
        for (int i = 0; i < activities.size(); i++) {
            Activity a = activities.get(i);
            if (!targets.contains(a.getActivityId())) {
                day.activity(a);
                continue;
            }
            Activity r = replacements.get(Math.min(k++, replacements.size() - 1));
            day.activity(r.toBuilder()
                    .activityId(ItineraryAssembler.activityId(original.getDayNumber(), i + 1, r.getTitle()))
                    .startTime(a.getStartTime())
                    .endTime(a.getEndTime())
                    .build());
        }
        return day.templatePlan(original.isTemplatePlan() || composed.isTemplatePlan()).build();
    }

    private static List<SourceStatus> mergeSources(List<SourceStatus> parentSources, GatherResult gathered) {
        Map<ProviderType, SourceStatus> merged = new EnumMap<>(ProviderType.class);
        if (parentSources != null) {
            for (SourceStatus s : parentSources) {
                merged.put(s.getProvider(), s);
            }
        }
        for (SourceStatus s : gathered.sourceStatuses()) {
            merged.put(s.getProvider(), s);
        }
        return new ArrayList<>(merged.values());
    }
}
