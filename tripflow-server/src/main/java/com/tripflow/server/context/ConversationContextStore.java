package com.tripflow.server.context;

import com.tripflow.common.constant.RedisConstants;
import com.tripflow.common.exception.StorageUnavailableException;
import com.tripflow.common.properties.PlannerProperties;
import com.tripflow.pojo.model.context.ConversationContext;
import com.tripflow.pojo.model.context.ExtractedSlot;
import com.tripflow.pojo.model.context.SlotName;
import com.tripflow.pojo.model.context.SlotValue;
import com.tripflow.pojo.model.context.Turn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * 会话上下文存储：所有组件读取槽位的唯一入口。
 *
 * <ul>
 *     <li>同一会话 key 的读-改-写通过 Redisson 分布式锁串行化，不同会话互不影响；</li>
 *     <li>applyTurn 按 turnId 幂等，重复投递直接返回当前上下文，不做任何写入；</li>
 *     <li>存储故障同步抛出 StorageUnavailableException，不会静默丢弃槽位。</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConversationContextStore {

    private static final long LOCK_LEASE_MS = 10_000L;

    private final ConversationContextRepository repository;
    private final SlotMergePolicy slotMergePolicy;
    private final RedissonClient redissonClient;
    private final PlannerProperties plannerProperties;
    private final Clock clock;

    public ConversationContext getOrCreate(String key) {
        ConversationContext existing = repository.load(key);
        if (existing != null) {
            return existing;
        }
        return withLock(key, ctx -> ctx);
    }

    /**
     * 合并一轮对话的抽取结果。key 不存在时创建新上下文。
     */
    public ConversationContext applyTurn(String key, Turn turn, List<ExtractedSlot> extractedSlots) {
        if (turn.getTurnId() == null) {
            turn.setTurnId(UUID.randomUUID().toString());
        }
        return withLock(key, ctx -> {
            if (ctx.hasTurn(turn.getTurnId())) {
                log.info("重复的对话轮次，忽略: key={}, turnId={}", key, turn.getTurnId());
                return ctx;
            }
            int turnIndex = ctx.getTurns().size();
            List<ExtractedSlot> extracted = extractedSlots == null ? new ArrayList<>() : new ArrayList<>(extractedSlots);
            turn.setExtracted(extracted);
            if (turn.getTimestamp() == 0L) {
                turn.setTimestamp(clock.millis());
            }
            ctx.getTurns().add(turn);

            for (ExtractedSlot slot : extracted) {
                SlotValue current = ctx.getSlots().get(slot.getName());
                if (slotMergePolicy.shouldOverwrite(current, slot)) {
                    ctx.getSlots().put(slot.getName(),
                            new SlotValue(slot.getValue(), turnIndex, slot.getConfidence()));
                } else {
                    log.debug("保留已确认槽位: key={}, slot={}, kept={}, ignored={}",
                            key, slot.getName(), current.getValue(), slot.getValue());
                }
            }
            ctx.setUpdatedAt(clock.millis());
            repository.save(ctx);
            return ctx;
        });
    }

    public Map<SlotName, SlotValue> getSlots(String key) {
        ConversationContext ctx = repository.load(key);
        if (ctx == null) {
            return new EnumMap<>(SlotName.class);
        }
        Map<SlotName, SlotValue> slots = new EnumMap<>(SlotName.class);
        slots.putAll(ctx.getSlots());
        return slots;
    }

    /**
     * 记录该会话最新生成的行程版本，后续修改请求默认基于它。
     */
    public void bindVersion(String key, Long versionId) {
        withLock(key, ctx -> {
            ctx.setLastVersionId(versionId);
            ctx.setUpdatedAt(clock.millis());
            repository.save(ctx);
            return ctx;
        });
    }

    private ConversationContext withLock(String key, Function<ConversationContext, ConversationContext> action) {
        RLock lock = redissonClient.getLock(RedisConstants.LOCK_CONVERSATION_KEY + key);
        boolean locked = false;
        try {
            locked = lock.tryLock(plannerProperties.getContextLockWaitMs(), LOCK_LEASE_MS, TimeUnit.MILLISECONDS);
            if (!locked) {
                log.warn("获取会话写锁超时, key={}", key);
                throw new StorageUnavailableException("会话正在被其他请求更新，请稍后重试");
            }
            ConversationContext ctx = repository.load(key);
            if (ctx == null) {
                ctx = new ConversationContext(key, clock.millis());
                repository.save(ctx);
            }
            return action.apply(ctx);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("等待会话写锁被中断", e);
        } catch (RedisException e) {
            throw new StorageUnavailableException("会话写锁不可用", e);
        } finally {
            if (locked && lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }
}
