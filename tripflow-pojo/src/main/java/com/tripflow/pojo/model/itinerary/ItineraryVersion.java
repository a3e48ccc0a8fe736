package com.tripflow.pojo.model.itinerary;

import com.tripflow.pojo.model.payload.FlightOption;
import com.tripflow.pojo.model.payload.HotelOption;
import com.tripflow.pojo.model.source.SourceStatus;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * 行程版本：不可变快照。任何修改都会生成一个引用父版本的新版本，
 * 同一行程下的版本号严格递增。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ItineraryVersion {

    Long versionId;

    /** 同一行程的所有版本共享 itineraryId */
    Long itineraryId;

    int versionNumber;

    Long parentVersionId;

    String conversationKey;

    String destination;

    LocalDate startDate;

    LocalDate endDate;

    @Singular
    List<DayPlan> days;

    @Singular
    List<FlightOption> flights;

    @Singular
    List<HotelOption> hotels;

    /** 生成该版本时各数据源的状态，重规划时未重新采集的数据源沿用父版本 */
    @Singular
    List<SourceStatus> sources;

    boolean degraded;

    /** 行程主体由模板生成（LLM 不可用） */
    boolean templatePlan;

    /** 重规划时的修改摘要 */
    String modificationSummary;

    long createdAt;

    public DayPlan dayByNumber(int dayNumber) {
        for (DayPlan day : days) {
            if (day.getDayNumber() == dayNumber) {
                return day;
            }
        }
        return null;
    }

    /**
     * 返回包含该活动的天数，找不到返回 -1。
     */
    public int dayOfActivity(String activityId) {
        for (DayPlan day : days) {
            for (Activity a : day.getActivities()) {
                if (a.getActivityId().equals(activityId)) {
                    return day.getDayNumber();
                }
            }
        }
        return -1;
    }
}
