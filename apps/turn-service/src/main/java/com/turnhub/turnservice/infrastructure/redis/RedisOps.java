package com.turnhub.turnservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 公用 Redis 工具类：
 * - 封装常用 String/Hash/Set/Key 操作
 * - 仅提供“原语级”方法；业务键名与字段名放在 Repo 层组织
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "turnhost.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisOps {
    /** 通用对象模板：用于 JSON 存储与反序列化 */
    private final RedisTemplate<String, Object> redis;

    // -------------- String --------------
    /**
     * 写入键值（无 TTL）
     */
    public boolean set(String key, Object val) {
        redis.opsForValue().set(key, val);
        return true;
    }

    /**
     * 获取键值并自动反序列化为指定类型
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return (v == null) ? null : (T) v;
    }

    // -------------- Hash --------------
    /**
     * 写入 Hash 字段
     */
    public boolean hSet(String key, String field, Object val) {
        redis.opsForHash().put(key, field, val);
        return true;
    }

    /**
     * 仅当字段不存在时写入（HSETNX）
     * @return true 表示写入成功，false 表示字段已存在
     */
    public boolean hSetNx(String key, String field, Object val) {
        Boolean ok = redis.opsForHash().putIfAbsent(key, field, val);
        return Boolean.TRUE.equals(ok);
    }

    /**
     * 获取单个 Hash 字段并反序列化
     */
    @SuppressWarnings("unchecked")
    public <T> T hGet(String key, String field, Class<T> type) {
        Object v = redis.opsForHash().get(key, field);
        return (v == null) ? null : (T) v;
    }

    /**
     * 获取整个 Hash（转为 Map<String,Object>）
     */
    public Map<String, Object> hGetAll(String key) {
        Map<Object, Object> raw = redis.opsForHash().entries(key);
        Map<String, Object> out = new HashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    /**
     * 删除指定 Hash 字段
     */
    public Long hDel(String key, String... fields) {
        return redis.opsForHash().delete(key, (Object[]) fields);
    }

    // -------------- Set --------------
    /**
     * 加入集合（用作索引）
     */
    public Long sAdd(String key, String... members) {
        return redis.opsForSet().add(key, (Object[]) members);
    }

    public Long sRem(String key, String... members) {
        return redis.opsForSet().remove(key, (Object[]) members);
    }

    /**
     * 集合成员（转为字符串）
     */
    public Set<String> sMembers(String key) {
        Set<Object> raw = redis.opsForSet().members(key);
        if (raw == null) return Set.of();
        return raw.stream().map(String::valueOf).collect(Collectors.toSet());
    }

    // -------------- Key --------------
    /**
     * 删除一个或多个 Key
     */
    public Long del(String... keys) {
        return redis.delete(Arrays.asList(keys));
    }
}
