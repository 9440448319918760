package com.turnhub.turnservice.common.error;

/** 最新回合记录处于 FAILED，需要运维显式 resume。 */
public class RecoveryRequiredException extends TurnHubException {

    public RecoveryRequiredException(String sessionId, String message) {
        super(ErrorKind.RECOVERY_REQUIRED, sessionId, message);
    }

    public RecoveryRequiredException(String sessionId, String message, Throwable cause) {
        super(ErrorKind.RECOVERY_REQUIRED, sessionId, message, cause);
    }
}
