package com.tripflow.pojo.model.itinerary;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * 单日行程。不可变：重规划时未受影响的天直接引用父版本的同一个对象。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DayPlan {

    int dayNumber;

    LocalDate date;

    String title;

    @Singular
    List<Activity> activities;

    String weatherSummary;

    boolean weatherEstimated;

    /** 该天内容来自模板而非 LLM */
    boolean templatePlan;
}
