package com.tripflow.server.config;

import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Redisson 客户端，复用 spring.redis.* 连接配置。
 * 用于会话上下文写锁与版本号分配锁。
 */
@Configuration
@Slf4j
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(RedisProperties redisProperties) {
        String address = "redis://" + redisProperties.getHost() + ":" + redisProperties.getPort();
        log.info("创建 RedissonClient: address={}, database={}", address, redisProperties.getDatabase());
        Config config = new Config();
        SingleServerConfig server = config.useSingleServer()
                .setAddress(address)
                .setDatabase(redisProperties.getDatabase());
        if (StringUtils.hasText(redisProperties.getPassword())) {
            server.setPassword(redisProperties.getPassword());
        }
        return Redisson.create(config);
    }
}
