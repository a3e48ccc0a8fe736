package com.tripflow.common.constant;

public class RedisConstants {

    private RedisConstants() {
    }

    /** 会话上下文前缀 conversation:ctx:{key}，不设过期时间，只能由运维显式删除 */
    public static final String CONVERSATION_CONTEXT_KEY = "conversation:ctx:";

    /** 会话上下文写锁前缀 lock:conversation:{key} */
    public static final String LOCK_CONVERSATION_KEY = "lock:conversation:";

    /** 任务快照前缀 task:snapshot:{taskId} */
    public static final String TASK_SNAPSHOT_KEY = "task:snapshot:";

    /** 任务快照 TTL（秒） */
    public static final long TASK_SNAPSHOT_TTL_SECONDS = 3600L;

    /** 活跃任务集合 */
    public static final String TASK_ACTIVE_SET = "task:active";

    /** 行程版本缓存前缀 cache:itinerary:version:{versionId} */
    public static final String CACHE_VERSION_KEY = "cache:itinerary:version:";

    /** 行程版本缓存 TTL（分钟），版本不可变，可以缓存较久 */
    public static final long CACHE_VERSION_TTL_MINUTES = 60L;

    /** 版本号分配锁前缀 lock:itinerary:{itineraryId} */
    public static final String LOCK_ITINERARY_KEY = "lock:itinerary:";

    /** 缓存空值 TTL（分钟） */
    public static final long CACHE_NULL_TTL = 2L;

    /** ID 生成器业务前缀 */
    public static final String ID_TASK = "task";
    public static final String ID_VERSION = "itinerary:version";
    public static final String ID_ITINERARY = "itinerary";
}
