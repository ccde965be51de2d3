package com.sutdahub.gameservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 公用 Redis 工具类：
 * - 封装常用 String/Hash/List/ZSet/Key/发布 操作
 * - 仅提供“原语级”方法；业务键名与字段名放在 Repo/Store 层组织
 * - 值统一为字符串（JSON 由调用方负责）
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** 字符串模板 */
    private final StringRedisTemplate strRedis;

    // -------------- String --------------
    /**
     * 获取简单字符串值
     */
    public String getString(String key) {
        return strRedis.opsForValue().get(key);
    }

    /**
     * 仅当不存在时写入字符串键值（SETNX），带 TTL。
     * @return true 表示写入成功，false 表示已存在
     */
    public boolean setStringNx(String key, String val, Duration ttl) {
        Boolean ok = strRedis.opsForValue().setIfAbsent(key, val, ttl);
        return Boolean.TRUE.equals(ok);
    }

    // -------------- Hash --------------
    /**
     * 获取整个 Hash（转为 Map<String,String>）
     */
    public Map<String, String> hGetAll(String key) {
        Map<Object, Object> raw = strRedis.opsForHash().entries(key);
        Map<String, String> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), String.valueOf(v)));
        return out;
    }

    // -------------- List --------------
    /**
     * 尾部追加
     */
    public Long rPush(String key, String val) {
        return strRedis.opsForList().rightPush(key, val);
    }

    /**
     * 区间读取（含两端，-1 表示末尾）
     */
    public List<String> lRange(String key, long start, long end) {
        List<String> out = strRedis.opsForList().range(key, start, end);
        return out == null ? Collections.emptyList() : out;
    }

    // -------------- ZSet --------------
    /**
     * 按分数区间读取成员（升序）
     */
    public Set<String> zRangeByScore(String key, double min, double max) {
        Set<String> out = strRedis.opsForZSet().rangeByScore(key, min, max);
        return out == null ? Collections.emptySet() : out;
    }

    // -------------- Key & TTL --------------
    /**
     * 设置过期时间（TTL）
     */
    public Boolean expire(String key, Duration ttl) {
        return strRedis.expire(key, ttl);
    }

    // -------------- Pub/Sub --------------
    /**
     * 向频道发布消息
     */
    public void publish(String channel, String message) {
        strRedis.convertAndSend(channel, message);
    }
}
