package com.turnhub.turnservice.common.error;

public class SessionNotFoundException extends TurnHubException {

    public SessionNotFoundException(String sessionId) {
        super(ErrorKind.SESSION_NOT_FOUND, sessionId, "对局不存在: " + sessionId);
    }
}
