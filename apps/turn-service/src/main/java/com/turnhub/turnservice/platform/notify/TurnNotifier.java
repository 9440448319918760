package com.turnhub.turnservice.platform.notify;

import com.turnhub.turnkafkanotifier.event.TurnNotificationEvent;

/**
 * 回合通知出口。编排器只依赖这个接口，不关心事件最终去向。
 */
public interface TurnNotifier {

    void notify(TurnNotificationEvent event);
}
