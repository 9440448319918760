package com.turnhub.turnservice.session;

import com.turnhub.turnservice.domain.enums.SessionEvent;
import com.turnhub.turnservice.domain.enums.SessionPhase;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 生命周期迁移表：(当前阶段, 事件) -> 目标阶段。表中没有的组合即非法迁移。
 *
 * <pre>
 * CREATED  --LAUNCH-->        LAUNCHED
 * LAUNCHED --LAUNCH-->        LAUNCHED   (重新拉起进程)
 * STARTED  --LAUNCH-->        STARTED    (重新拉起进程)
 * LAUNCHED --START_PLAY-->    STARTED
 * STARTED  --END_GAME-->      ENDED
 * ENDED    --DELETE_LOBBY-->  DELETED
 * LAUNCHED --RESET_STARTED--> LAUNCHED   (特权)
 * STARTED  --RESET_STARTED--> LAUNCHED   (特权)
 * </pre>
 */
final class SessionTransitionTable {

    private static final Map<SessionPhase, Map<SessionEvent, SessionPhase>> TABLE = new EnumMap<>(SessionPhase.class);

    static {
        put(SessionPhase.CREATED, SessionEvent.LAUNCH, SessionPhase.LAUNCHED);
        put(SessionPhase.LAUNCHED, SessionEvent.LAUNCH, SessionPhase.LAUNCHED);
        put(SessionPhase.STARTED, SessionEvent.LAUNCH, SessionPhase.STARTED);
        put(SessionPhase.LAUNCHED, SessionEvent.START_PLAY, SessionPhase.STARTED);
        put(SessionPhase.STARTED, SessionEvent.END_GAME, SessionPhase.ENDED);
        put(SessionPhase.ENDED, SessionEvent.DELETE_LOBBY, SessionPhase.DELETED);
        put(SessionPhase.LAUNCHED, SessionEvent.RESET_STARTED, SessionPhase.LAUNCHED);
        put(SessionPhase.STARTED, SessionEvent.RESET_STARTED, SessionPhase.LAUNCHED);
    }

    private SessionTransitionTable() {}

    private static void put(SessionPhase from, SessionEvent event, SessionPhase to) {
        TABLE.computeIfAbsent(from, k -> new EnumMap<>(SessionEvent.class)).put(event, to);
    }

    static Optional<SessionPhase> next(SessionPhase from, SessionEvent event) {
        Map<SessionEvent, SessionPhase> row = TABLE.get(from);
        return row == null ? Optional.empty() : Optional.ofNullable(row.get(event));
    }
}
