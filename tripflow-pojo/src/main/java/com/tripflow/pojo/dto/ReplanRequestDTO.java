package com.tripflow.pojo.dto;

import com.tripflow.pojo.model.itinerary.ReplanKind;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 重规划请求体 DTO。
 * Modification request against an existing itinerary version.
 */
@Data
public class ReplanRequestDTO {

    private ReplanKind kind;

    /**
     * 明确指定的天数（从 1 开始）。
     */
    private List<Integer> dayNumbers = new ArrayList<>();

    /**
     * 明确指定的活动 ID。
     */
    private List<String> activityIds = new ArrayList<>();

    /**
     * 自由文本描述，例如“第三天换成海边活动”。
     */
    private String instruction;

    private String requestId;
}
