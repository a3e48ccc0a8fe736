package com.tripflow.pojo.model.context;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 一轮对话。turnId 由客户端分配，用于重复投递去重。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Turn {

    private String turnId;

    private TurnRole role;

    private String text;

    /** 本轮抽取出的意图槽位，可能为空 */
    private List<ExtractedSlot> extracted = new ArrayList<>();

    /** epoch millis */
    private long timestamp;
}
