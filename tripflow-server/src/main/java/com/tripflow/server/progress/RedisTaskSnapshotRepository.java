package com.tripflow.server.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.common.constant.RedisConstants;
import com.tripflow.common.exception.StorageUnavailableException;
import com.tripflow.pojo.model.task.TaskSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * task:snapshot:{taskId} -> JSON，TTL 1 小时；未终态的任务 id 记录在 task:active 集合中。
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class RedisTaskSnapshotRepository implements TaskSnapshotRepository {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void save(TaskSnapshot snapshot) {
        String json;
        try {
            json = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("任务快照序列化失败", e);
        }
        String id = String.valueOf(snapshot.getTaskId());
        try {
            stringRedisTemplate.opsForValue().set(RedisConstants.TASK_SNAPSHOT_KEY + id, json,
                    RedisConstants.TASK_SNAPSHOT_TTL_SECONDS, TimeUnit.SECONDS);
            if (snapshot.isTerminal()) {
                stringRedisTemplate.opsForSet().remove(RedisConstants.TASK_ACTIVE_SET, id);
            } else {
                stringRedisTemplate.opsForSet().add(RedisConstants.TASK_ACTIVE_SET, id);
            }
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("写入任务快照失败", e);
        }
    }

    @Override
    public TaskSnapshot load(Long taskId) {
        String json;
        try {
            json = stringRedisTemplate.opsForValue().get(RedisConstants.TASK_SNAPSHOT_KEY + taskId);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("读取任务快照失败", e);
        }
        if (!StringUtils.hasText(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, TaskSnapshot.class);
        } catch (JsonProcessingException e) {
            log.error("任务快照反序列化失败, taskId={}", taskId, e);
            throw new StorageUnavailableException("任务快照数据损坏", e);
        }
    }

    @Override
    public Set<Long> activeTaskIds() {
        Set<String> members;
        try {
            members = stringRedisTemplate.opsForSet().members(RedisConstants.TASK_ACTIVE_SET);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("读取活跃任务集合失败", e);
        }
        if (members == null || members.isEmpty()) {
            return Collections.emptySet();
        }
        Set<Long> ids = new HashSet<>();
        for (String m : members) {
            try {
                ids.add(Long.valueOf(m));
            } catch (NumberFormatException e) {
                log.warn("活跃任务集合中存在非法 id: {}", m);
            }
        }
        return ids;
    }

    @Override
    public void removeActive(Long taskId) {
        try {
            stringRedisTemplate.opsForSet().remove(RedisConstants.TASK_ACTIVE_SET, String.valueOf(taskId));
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("更新活跃任务集合失败", e);
        }
    }
}
