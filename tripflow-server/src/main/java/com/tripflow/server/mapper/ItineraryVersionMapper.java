package com.tripflow.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tripflow.pojo.entity.ItineraryVersionEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ItineraryVersionMapper extends BaseMapper<ItineraryVersionEntity> {

    /**
     * 行程当前最大版本号，没有版本时返回 0
     */
    @Select("SELECT COALESCE(MAX(version_number), 0) FROM itinerary_version WHERE itinerary_id = #{itineraryId}")
    int selectMaxVersionNumber(@Param("itineraryId") Long itineraryId);
}
