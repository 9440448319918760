package com.turnhub.turnservice.common.error;

import com.turnhub.turnservice.domain.enums.SessionEvent;
import com.turnhub.turnservice.domain.enums.SessionPhase;
import lombok.Getter;

/**
 * 生命周期迁移不合法（例如未开始就结束、未结束就删除）。
 */
@Getter
public class InvalidStateTransitionException extends TurnHubException {

    private final SessionPhase from;
    private final SessionEvent event;

    public InvalidStateTransitionException(String sessionId, SessionPhase from, SessionEvent event) {
        super(ErrorKind.INVALID_STATE_TRANSITION, sessionId,
                "非法状态迁移: " + from + " --" + event + "--> ?");
        this.from = from;
        this.event = event;
    }

    public InvalidStateTransitionException(String sessionId, String message) {
        super(ErrorKind.INVALID_STATE_TRANSITION, sessionId, message);
        this.from = null;
        this.event = null;
    }
}
