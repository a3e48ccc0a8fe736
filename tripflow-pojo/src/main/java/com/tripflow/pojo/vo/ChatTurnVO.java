package com.tripflow.pojo.vo;

import com.tripflow.pojo.model.context.SlotName;
import lombok.Data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 单轮对话的处理结果。
 */
@Data
public class ChatTurnVO {

    private String conversationKey;

    private String turnId;

    /** 合并后的槽位 */
    private Map<SlotName, String> slots = new EnumMap<>(SlotName.class);

    /** 生成行程前仍需补充的槽位 */
    private List<SlotName> missingSlots = new ArrayList<>();

    /** 给用户的回复或追问 */
    private String reply;

    /** 本轮触发了生成或重规划任务时非空 */
    private Long taskId;

    /** 重复投递的轮次 */
    private boolean duplicate;

    /** 修改范围不明确，reply 是澄清问题 */
    private boolean needsClarification;
}
