package com.tripflow.pojo.model.itinerary;

public enum ReplanKind {
    /** 替换单个活动 */
    ACTIVITY_SWAP,
    /** 重排某一天或某几天 */
    DAY_REPLAN,
    /** 更换酒店 */
    HOTEL_CHANGE
}
