package com.turnhub.turnservice.common.error;

import org.springframework.http.HttpStatus;

/**
 * 对外暴露的错误类别及其 HTTP 状态映射。
 */
public enum ErrorKind {
    INVALID_STATE_TRANSITION(HttpStatus.CONFLICT),
    LIMIT_EXCEEDED(HttpStatus.UNPROCESSABLE_ENTITY),
    INSUFFICIENT_BALANCE(HttpStatus.UNPROCESSABLE_ENTITY),
    BACKUP_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR),
    PROCESS_UNRESPONSIVE(HttpStatus.BAD_GATEWAY),
    CONCURRENT_ADVANCE_IN_PROGRESS(HttpStatus.CONFLICT),
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND),
    RECOVERY_REQUIRED(HttpStatus.CONFLICT),
    SNAPSHOT_NOT_FOUND(HttpStatus.NOT_FOUND);

    private final HttpStatus httpStatus;

    ErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }
}
