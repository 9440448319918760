package com.turnhub.turnservice.common.error;

/** 本回合延时次数已用完。 */
public class LimitExceededException extends TurnHubException {

    public LimitExceededException(String sessionId, String message) {
        super(ErrorKind.LIMIT_EXCEEDED, sessionId, message);
    }

    public LimitExceededException(String sessionId, String message, Throwable cause) {
        super(ErrorKind.LIMIT_EXCEEDED, sessionId, message, cause);
    }
}
