package com.sutdahub.gameservice.infrastructure.redis;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * RedisConfig
 * -------------------------------------------------------
 * 全局 Redis 连接与模板配置（通用基础设施层）
 * -------------------------------------------------------
 * Responsibilities:
 *  - 提供 StringRedisTemplate：对局与玩家记录均以 JSON 字符串存储，
 *    由仓储层使用 ObjectMapper 按显式类型序列化/反序列化；
 *  - 提供 RedisMessageListenerContainer：按对局频道订阅状态变更通知。
 * -------------------------------------------------------
 * 当 sutda.store.type=memory 时不创建监听容器，进程内存储不依赖 Redis。
 */
@Configuration
public class RedisConfig {

    /**
     * 纯字符串操作模板（StringRedisTemplate）
     * Key/Value/HashKey/HashValue 均为 String。
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
        return new StringRedisTemplate(factory);
    }

    /**
     * 发布/订阅监听容器，用于 subscribeToChanges。
     */
    @Bean
    @ConditionalOnProperty(name = "sutda.store.type", havingValue = "redis", matchIfMissing = true)
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory factory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(factory);
        return container;
    }
}
