package com.tripflow.pojo.model.context;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 已合并进会话上下文的槽位值。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SlotValue {

    /** 归一化后的值：日期为 ISO 格式，预算为整数金额，兴趣为逗号分隔 */
    private String value;

    /** 写入该值的轮次下标（从 0 开始） */
    private int turnIndex;

    /** 置信度 [0,1] */
    private double confidence;
}
