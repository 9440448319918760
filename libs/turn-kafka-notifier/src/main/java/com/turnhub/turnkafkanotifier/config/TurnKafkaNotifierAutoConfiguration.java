package com.turnhub.turnkafkanotifier.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Import;

/**
 * 回合事件通知自动配置入口。
 *
 * 只有配置了 turn.kafka.bootstrap-servers 才启用；未配置时上层服务自行降级为日志通知。
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "turn.kafka", name = "bootstrap-servers")
@Import(TurnKafkaConfig.class)
public class TurnKafkaNotifierAutoConfiguration {
}
