package com.turnhub.turnkafkanotifier.publisher;

import com.alibaba.fastjson2.JSON;
import com.turnhub.turnkafkanotifier.event.TurnNotificationEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * 回合事件发布器。
 *
 * 以 sessionId 作为消息 key 发送到 Kafka，保证同一对局的事件在同一分区内有序。
 *
 * 使用方式：
 * <pre>
 * {@code
 * publisher.publish(TurnNotificationEvent.of(sessionId, name, EventType.PROCESS_DIED, "exit code 1"));
 * }
 * </pre>
 */
@Slf4j
public class TurnEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Value("${turn.kafka.topic:turn-events}")
    private String topic;

    public TurnEventPublisher(@Qualifier("turnKafkaTemplate") KafkaTemplate<String, String> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }

    /**
     * 发布回合事件。
     * 发送失败只记录日志：事件属于通知，不回滚已经落盘的回合状态。
     *
     * @param event 回合事件
     */
    public void publish(TurnNotificationEvent event) {
        if (event.getTimestamp() == null) {
            event.setTimestamp(Instant.now().toEpochMilli());
        }
        try {
            String message = JSON.toJSONString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, event.getSessionId(), message);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("回合事件发布成功: sessionId={}, type={}, offset={}",
                            event.getSessionId(), event.getEventType(), result.getRecordMetadata().offset());
                } else {
                    log.error("回合事件发布失败: sessionId={}, type={}", event.getSessionId(), event.getEventType(), ex);
                }
            });
        } catch (Exception e) {
            log.error("发布回合事件异常: sessionId={}, type={}", event.getSessionId(), event.getEventType(), e);
        }
    }

    String topic() {
        return topic;
    }
}
