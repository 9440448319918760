package com.turnhub.turnservice.common.error;

/** 同一对局已有推进在进行中。 */
public class ConcurrentAdvanceInProgressException extends TurnHubException {

    public ConcurrentAdvanceInProgressException(String sessionId, String message) {
        super(ErrorKind.CONCURRENT_ADVANCE_IN_PROGRESS, sessionId, message);
    }

    public ConcurrentAdvanceInProgressException(String sessionId, String message, Throwable cause) {
        super(ErrorKind.CONCURRENT_ADVANCE_IN_PROGRESS, sessionId, message, cause);
    }
}
