package com.tripflow.server.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.tripflow.pojo.entity.ItineraryVersionEntity;
import com.tripflow.pojo.model.itinerary.ItineraryVersion;

import java.util.List;

public interface ItineraryVersionService extends IService<ItineraryVersionEntity> {

    /**
     * 持久化新版本：分配 versionId，itineraryId 为空时分配新行程，版本号 = 该行程最大版本号 + 1。
     *
     * @return 带有分配结果的版本
     */
    ItineraryVersion saveVersion(ItineraryVersion draft);

    /**
     * 读穿缓存查询版本，不存在返回 null。
     */
    ItineraryVersion loadVersion(Long versionId);

    /**
     * 行程的全部版本，按版本号升序。
     */
    List<ItineraryVersion> listVersions(Long itineraryId);
}
