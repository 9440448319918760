package com.turnhub.turnservice.support;

import com.turnhub.turnkafkanotifier.event.TurnNotificationEvent;
import com.turnhub.turnkafkanotifier.event.TurnNotificationEvent.EventType;
import com.turnhub.turnservice.platform.notify.TurnNotifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingNotifier implements TurnNotifier {

    private final List<TurnNotificationEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void notify(TurnNotificationEvent event) {
        events.add(event);
    }

    public List<TurnNotificationEvent> all() {
        return List.copyOf(events);
    }

    public List<TurnNotificationEvent> ofType(EventType type) {
        return events.stream().filter(e -> e.getEventType() == type).toList();
    }

    public void clear() {
        events.clear();
    }
}
