package com.tripflow.pojo.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("itinerary_version")
public class ItineraryVersionEntity {

    /** 由 RedisIdWorker 生成 */
    @TableId(type = IdType.INPUT)
    private Long id;

    private Long itineraryId;

    private Integer versionNumber;

    private Long parentVersionId;

    private String conversationKey;

    private String destination;

    /** 完整版本内容（JSON） */
    private String payloadJson;

    private LocalDateTime createTime;
}
