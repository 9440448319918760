package com.turnhub.turnkafkanotifier.config;

import com.turnhub.turnkafkanotifier.publisher.TurnEventPublisher;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * 回合事件 Kafka 生产者配置。
 *
 * 配置要求（application.yml）：
 * <pre>
 * turn:
 *   kafka:
 *     bootstrap-servers: localhost:9092
 *     topic: turn-events
 * </pre>
 *
 * 注意：
 * - 条件控制由 {@link TurnKafkaNotifierAutoConfiguration} 统一管理，此处不需要 @ConditionalOnProperty。
 */
@Configuration
public class TurnKafkaConfig {

    /**
     * Kafka 集群地址，从 turn.kafka.bootstrap-servers 读取
     */
    @Value("${turn.kafka.bootstrap-servers}")
    private String bootstrapServers;

    /**
     * 创建 Kafka 生产者工厂。
     *
     * @return Key 和 Value 均为 String 的生产者工厂（Value 为 JSON 字符串）
     */
    @Bean
    public ProducerFactory<String, String> turnKafkaProducerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        // 回合通知不允许丢失：等待所有副本确认
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        // 幂等生产者，重试不产生重复通知
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        return new DefaultKafkaProducerFactory<>(props);
    }

    /**
     * KafkaTemplate（生产者）。
     */
    @Bean
    public KafkaTemplate<String, String> turnKafkaTemplate() {
        return new KafkaTemplate<>(turnKafkaProducerFactory());
    }

    /**
     * 回合事件发布器。
     */
    @Bean
    public TurnEventPublisher turnEventPublisher(@Qualifier("turnKafkaTemplate") KafkaTemplate<String, String> turnKafkaTemplate) {
        return new TurnEventPublisher(turnKafkaTemplate);
    }
}
