package com.turnhub.turnservice.common.error;

import lombok.Getter;

/**
 * 业务异常基类（非受检），携带错误类别与对局ID。
 */
@Getter
public class TurnHubException extends RuntimeException {

    private final ErrorKind kind;
    private final String sessionId;

    public TurnHubException(ErrorKind kind, String sessionId, String message) {
        super(message);
        this.kind = kind;
        this.sessionId = sessionId;
    }

    public TurnHubException(ErrorKind kind, String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.sessionId = sessionId;
    }
}
