package com.tripflow.server.ai;

import com.tripflow.pojo.model.itinerary.DayPlan;

import java.util.List;

/**
 * 行程编排：为 request.dayNumbers 中的每一天生成草稿 DayPlan（标题与活动），
 * 日期、天气、图片、交通由组装阶段补齐。
 */
public interface PlanComposer {

    /**
     * @return 与 dayNumbers 一一对应、按天数升序的草稿
     * @throws com.tripflow.common.exception.CompositionFailureException 编排失败
     */
    List<DayPlan> compose(ComposeRequest request);
}
