package com.turnhub.turnservice.common.error;

/** 棋钟余额不足。 */
public class InsufficientBalanceException extends TurnHubException {

    public InsufficientBalanceException(String sessionId, String message) {
        super(ErrorKind.INSUFFICIENT_BALANCE, sessionId, message);
    }

    public InsufficientBalanceException(String sessionId, String message, Throwable cause) {
        super(ErrorKind.INSUFFICIENT_BALANCE, sessionId, message, cause);
    }
}
