package com.turnhub.turnservice.infrastructure.redis;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * RedisConfig
 * -------------------------------------------------------
 * 对局持久化所用的 Redis 序列化配置（存储层基础设施）
 * -------------------------------------------------------
 * Responsibilities:
 *  - 为 RedisOps 提供唯一的 RedisTemplate&lt;String, Object&gt;；
 *  - 对局、计时器、时间银行、回合记录、快照索引都以 JSON 存在 Hash/String 里，
 *    反序列化时依赖值里携带的类型信息还原成领域对象；
 *  - 仅在 turnhost.store.type=redis（默认）时装配；memory 模式下整个 redis 包都不生效。
 * -------------------------------------------------------
 * 使用说明：
 *  - 键名统一由 {@link RedisKeys} 生成，本类不关心键结构；
 *  - 领域对象新增字段可直接兼容旧数据；改名或删字段前先确认线上已有数据能否反序列化。
 */
@Configuration
@ConditionalOnProperty(prefix = "turnhost.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    /**
     * Key 用 StringRedisSerializer 保持可读（如 turnhub:session:{id}），
     * Value 与 Hash Value 用 GenericJackson2JsonRedisSerializer。
     *
     * @param factory Spring Boot 自动配置的连接工厂（Lettuce）
     */
    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory factory) {
        RedisTemplate<String, Object> tpl = new RedisTemplate<>();
        tpl.setConnectionFactory(factory);

        StringRedisSerializer keySer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer valSer = new GenericJackson2JsonRedisSerializer();

        tpl.setKeySerializer(keySer);
        tpl.setValueSerializer(valSer);
        tpl.setHashKeySerializer(keySer);
        tpl.setHashValueSerializer(valSer);

        tpl.afterPropertiesSet();
        return tpl;
    }
}
