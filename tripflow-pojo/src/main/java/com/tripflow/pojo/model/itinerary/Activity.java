package com.tripflow.pojo.model.itinerary;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Activity {

    /** 版本内稳定的活动 ID，重规划时用于定位 */
    String activityId;

    /** HH:mm */
    String startTime;

    String endTime;

    String title;

    String description;

    String location;

    /** sightseeing / food / shopping / nature / culture / nightlife 等 */
    String category;

    String imageUrl;

    boolean imageEstimated;

    /** 从上一个活动过来的交通耗时（分钟） */
    Integer transitMinutes;

    boolean transitEstimated;
}
