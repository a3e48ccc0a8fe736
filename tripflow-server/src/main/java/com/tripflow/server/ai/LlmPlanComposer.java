package com.tripflow.server.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.common.exception.CompositionFailureException;
import com.tripflow.pojo.model.context.ResolvedTrip;
import com.tripflow.pojo.model.itinerary.Activity;
import com.tripflow.pojo.model.itinerary.DayPlan;
import com.tripflow.pojo.model.payload.DailyWeather;
import com.tripflow.pojo.model.payload.HotelPayload;
import com.tripflow.pojo.model.source.ProviderType;
import com.tripflow.server.utils.AiClient;
import com.tripflow.server.utils.JsonBlocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 基于 LLM 的行程编排：生成 + 校验，最多两轮。
 * 第二轮把第一轮被拒绝的原因附在提示词后面；两轮都不合格时抛 {@link CompositionFailureException}。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmPlanComposer implements PlanComposer {

    private static final int MAX_ROUNDS = 2;

    private static final Pattern TIME = Pattern.compile("^([01]\\d|2[0-3]):[0-5]\\d$");

    private static final String SYSTEM_PROMPT = "You are a travel planner. Return ONLY a JSON object: "
            + "{\"days\":[{\"dayNumber\":1,\"title\":\"...\",\"activities\":[{\"startTime\":\"09:00\",\"endTime\":\"11:00\","
            + "\"title\":\"...\",\"description\":\"...\",\"location\":\"...\",\"category\":\"sightseeing|food|shopping|nature|culture|nightlife\"}]}]}. "
            + "Produce exactly the requested day numbers, 3 to 5 activities per day in chronological order, times as HH:mm. "
            + "Prefer indoor activities on rainy days. Keep descriptions under 40 words.";

    private final AiClient aiClient;
    private final ObjectMapper objectMapper;

    public boolean isAvailable() {
        return aiClient.isConfigured();
    }

    @Override
    public List<DayPlan> compose(ComposeRequest request) {
        if (!aiClient.isConfigured()) {
            throw new CompositionFailureException("LLM 未配置");
        }
        String userPrompt = buildUserPrompt(request);
        String problem = null;
        for (int round = 1; round <= MAX_ROUNDS; round++) {
            String prompt = problem == null ? userPrompt
                    : userPrompt + "\nYour previous answer was rejected: " + problem + ". Fix it.";
            AiClient.AiReply reply = aiClient.chat(SYSTEM_PROMPT, prompt);
            if (!reply.isSuccess()) {
                problem = "llm_" + reply.getErrorType();
                log.warn("LLM 编排调用失败: round={}, errorType={}, status={}", round, reply.getErrorType(), reply.getStatusCode());
                if (!reply.isRetryable()) {
                    break;
                }
                continue;
            }
            List<DayPlan> days = parse(reply.getContent());
            problem = check(days, request.getDayNumbers());
            if (problem == null) {
                log.info("LLM 编排完成: round={}, days={}", round, days.size());
                return days;
            }
            log.warn("LLM 编排结果未通过校验: round={}, problem={}", round, problem);
        }
        throw new CompositionFailureException("LLM 行程编排失败: " + problem);
    }

    private String buildUserPrompt(ComposeRequest request) {
        ResolvedTrip trip = request.getTrip();
        StringBuilder sb = new StringBuilder();
        sb.append("Destination: ").append(trip.getDestination()).append('\n');
        sb.append("Dates: ").append(trip.getStartDate()).append(" to ").append(trip.getEndDate())
                .append(" (").append(trip.days()).append(" days)\n");
        sb.append("Travelers: ").append(trip.getTravelers());
        if (StringUtils.hasText(trip.getTravelerType())) {
            sb.append(", ").append(trip.getTravelerType());
        }
        sb.append('\n');
        if (trip.getBudget() != null) {
            sb.append("Budget: ").append(trip.getBudget()).append(' ').append(trip.getCurrency()).append('\n');
        }
        if (!trip.getInterests().isEmpty()) {
            sb.append("Interests: ").append(String.join(", ", trip.getInterests())).append('\n');
        }
        HotelPayload hotels = request.getGathered() == null ? null
                : request.getGathered().payload(ProviderType.HOTELS, HotelPayload.class);
        if (hotels != null && !hotels.getHotels().isEmpty()) {
            sb.append("Hotel: ").append(hotels.getHotels().get(0).getName()).append('\n');
        }
        sb.append("Days to plan:\n");
        for (Integer dayNumber : request.getDayNumbers()) {
            sb.append("- day ").append(dayNumber).append(" (").append(trip.dateOf(dayNumber)).append(')');
            DailyWeather w = request.weatherOn(trip.dateOf(dayNumber));
            if (w != null) {
                sb.append(" weather ").append(w.getCondition()).append(", rain ").append(w.getPrecipitationChance()).append('%');
            }
            sb.append('\n');
        }
        if (!request.getKeptDays().isEmpty()) {
            sb.append("Other days already planned (do not repeat them):\n");
            for (DayPlan kept : request.getKeptDays()) {
                sb.append("- day ").append(kept.getDayNumber()).append(": ").append(kept.getTitle()).append('\n');
            }
        }
        if (StringUtils.hasText(request.getInstruction())) {
            sb.append("User request: ").append(request.getInstruction()).append('\n');
        }
        return sb.toString();
    }

    /**
     * 解析失败返回 null。
     */
    List<DayPlan> parse(String content) {
        try {
            JsonNode root = objectMapper.readTree(JsonBlocks.strip(content));
            JsonNode days = root.path("days");
            if (!days.isArray()) {
                return null;
            }
            List<DayPlan> result = new ArrayList<>();
            for (JsonNode d : days) {
                DayPlan.DayPlanBuilder day = DayPlan.builder()
                        .dayNumber(d.path("dayNumber").asInt(-1))
                        .title(d.path("title").asText(""));
                for (JsonNode a : d.path("activities")) {
                    day.activity(Activity.builder()
                            .startTime(a.path("startTime").asText(""))
                            .endTime(a.path("endTime").asText(""))
                            .title(a.path("title").asText(""))
                            .description(a.path("description").asText(null))
                            .location(a.path("location").asText(null))
                            .category(a.path("category").asText("sightseeing"))
                            .build());
                }
                result.add(day.build());
            }
            result.sort(Comparator.comparingInt(DayPlan::getDayNumber));
            return result;
        } catch (Exception e) {
            log.debug("解析 LLM 行程输出失败: {}", e.getMessage());
            return null;
        }
    }

    /**
     * 校验草稿，合格返回 null，否则返回问题描述。
     */
    static String check(List<DayPlan> days, List<Integer> expectedDays) {
        if (days == null) {
            return "output is not the requested JSON";
        }
        Set<Integer> got = new HashSet<>();
        for (DayPlan day : days) {
            got.add(day.getDayNumber());
            if (day.getActivities().isEmpty()) {
                return "day " + day.getDayNumber() + " has no activities";
            }
            String previousEnd = null;
            for (Activity a : day.getActivities()) {
                if (!StringUtils.hasText(a.getTitle())) {
                    return "activity without title on day " + day.getDayNumber();
                }
                if (!TIME.matcher(a.getStartTime()).matches() || !TIME.matcher(a.getEndTime()).matches()) {
                    return "invalid time on day " + day.getDayNumber();
                }
                if (a.getEndTime().compareTo(a.getStartTime()) <= 0
                        || (previousEnd != null && a.getStartTime().compareTo(previousEnd) < 0)) {
                    return "overlapping or reversed times on day " + day.getDayNumber();
                }
                previousEnd = a.getEndTime();
            }
        }
        if (days.size() != expectedDays.size() || !got.equals(new HashSet<>(expectedDays))) {
            return "expected days " + expectedDays + " but got " + got;
        }
        return null;
    }
}
