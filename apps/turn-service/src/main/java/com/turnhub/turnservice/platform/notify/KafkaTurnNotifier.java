package com.turnhub.turnservice.platform.notify;

import com.turnhub.turnkafkanotifier.event.TurnNotificationEvent;
import com.turnhub.turnkafkanotifier.publisher.TurnEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * 默认通知实现：配置了 turn.kafka.bootstrap-servers 时发往 Kafka，否则只写日志。
 */
@Slf4j
@Component
public class KafkaTurnNotifier implements TurnNotifier {

    private final ObjectProvider<TurnEventPublisher> publisher;

    public KafkaTurnNotifier(ObjectProvider<TurnEventPublisher> publisher) {
        this.publisher = publisher;
    }

    @Override
    public void notify(TurnNotificationEvent event) {
        TurnEventPublisher p = publisher.getIfAvailable();
        if (p == null) {
            log.info("回合事件(未启用Kafka): sessionId={}, type={}, turn={}, outstanding={}, msg={}",
                    event.getSessionId(), event.getEventType(), event.getTurnNumber(),
                    event.getOutstandingPlayers(), event.getMessage());
            return;
        }
        p.publish(event);
    }
}
