package com.turnhub.turnservice.common.error;

/** 推进信号重试耗尽后引擎仍未确认新回合，或进程已退出。 */
public class ProcessUnresponsiveException extends TurnHubException {

    public ProcessUnresponsiveException(String sessionId, String message) {
        super(ErrorKind.PROCESS_UNRESPONSIVE, sessionId, message);
    }

    public ProcessUnresponsiveException(String sessionId, String message, Throwable cause) {
        super(ErrorKind.PROCESS_UNRESPONSIVE, sessionId, message, cause);
    }
}
