package com.tripflow.server.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.common.constant.RedisConstants;
import com.tripflow.common.exception.StorageUnavailableException;
import com.tripflow.pojo.entity.ItineraryVersionEntity;
import com.tripflow.pojo.model.itinerary.ItineraryVersion;
import com.tripflow.server.mapper.ItineraryVersionMapper;
import com.tripflow.server.service.ItineraryVersionService;
import com.tripflow.server.utils.CacheClient;
import com.tripflow.server.utils.RedisIdWorker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Service
@RequiredArgsConstructor
@Slf4j
public class ItineraryVersionServiceImpl extends ServiceImpl<ItineraryVersionMapper, ItineraryVersionEntity>
        implements ItineraryVersionService {

    private final CacheClient cacheClient;
    private final RedissonClient redissonClient;
    private final RedisIdWorker redisIdWorker;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public ItineraryVersion saveVersion(ItineraryVersion draft) {
        Long itineraryId = draft.getItineraryId() != null
                ? draft.getItineraryId() : redisIdWorker.nextId(RedisConstants.ID_ITINERARY);
        Long versionId = redisIdWorker.nextId(RedisConstants.ID_VERSION);

        // 同一行程的版本号分配需要串行
        RLock lock = redissonClient.getLock(RedisConstants.LOCK_ITINERARY_KEY + itineraryId);
        boolean locked = false;
        try {
            locked = lock.tryLock(2, 10, TimeUnit.SECONDS);
            if (!locked) {
                throw new StorageUnavailableException("获取行程版本锁超时: " + itineraryId);
            }
            int versionNumber = baseMapper.selectMaxVersionNumber(itineraryId) + 1;
            long now = clock.millis();
            ItineraryVersion version = draft.toBuilder()
                    .versionId(versionId)
                    .itineraryId(itineraryId)
                    .versionNumber(versionNumber)
                    .createdAt(now)
                    .build();

            ItineraryVersionEntity entity = new ItineraryVersionEntity();
            entity.setId(versionId);
            entity.setItineraryId(itineraryId);
            entity.setVersionNumber(versionNumber);
            entity.setParentVersionId(version.getParentVersionId());
            entity.setConversationKey(version.getConversationKey());
            entity.setDestination(version.getDestination());
            entity.setPayloadJson(objectMapper.writeValueAsString(version));
            entity.setCreateTime(LocalDateTime.ofInstant(Instant.ofEpochMilli(now), ZoneId.systemDefault()));
            save(entity);

            cacheClient.set(RedisConstants.CACHE_VERSION_KEY + versionId, version,
                    RedisConstants.CACHE_VERSION_TTL_MINUTES, TimeUnit.MINUTES);
            log.info("行程版本已保存: itineraryId={}, versionId={}, versionNumber={}, parent={}",
                    itineraryId, versionId, versionNumber, version.getParentVersionId());
            return version;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("等待行程版本锁被中断", e);
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("行程版本序列化失败", e);
        } catch (DataAccessException | RedisException e) {
            log.error("保存行程版本失败: itineraryId={}", itineraryId, e);
            throw new StorageUnavailableException("保存行程版本失败", e);
        } finally {
            if (locked && lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

    @Override
    public ItineraryVersion loadVersion(Long versionId) {
        if (versionId == null) {
            return null;
        }
        return cacheClient.queryWithPassThrough(
                RedisConstants.CACHE_VERSION_KEY,
                versionId,
                ItineraryVersion.class,
                this::loadFromDb,
                RedisConstants.CACHE_VERSION_TTL_MINUTES,
                TimeUnit.MINUTES,
                RedisConstants.CACHE_NULL_TTL
        );
    }

    @Override
    public List<ItineraryVersion> listVersions(Long itineraryId) {
        List<ItineraryVersionEntity> entities;
        try {
            entities = lambdaQuery()
                    .eq(ItineraryVersionEntity::getItineraryId, itineraryId)
                    .orderByAsc(ItineraryVersionEntity::getVersionNumber)
                    .list();
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("查询行程版本失败", e);
        }
        List<ItineraryVersion> versions = new ArrayList<>();
        for (ItineraryVersionEntity entity : entities) {
            versions.add(toVersion(entity));
        }
        return versions;
    }

    private ItineraryVersion loadFromDb(Long versionId) {
        ItineraryVersionEntity entity;
        try {
            entity = getById(versionId);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("查询行程版本失败", e);
        }
        return entity == null ? null : toVersion(entity);
    }

    private ItineraryVersion toVersion(ItineraryVersionEntity entity) {
        try {
            return objectMapper.readValue(entity.getPayloadJson(), ItineraryVersion.class);
        } catch (JsonProcessingException e) {
            log.error("行程版本数据损坏: versionId={}", entity.getId(), e);
            throw new StorageUnavailableException("行程版本数据损坏", e);
        }
    }
}
