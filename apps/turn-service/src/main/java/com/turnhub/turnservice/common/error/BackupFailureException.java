package com.turnhub.turnservice.common.error;

/** 备份写入/校验/恢复失败。出现该异常时绝不能推进引擎。 */
public class BackupFailureException extends TurnHubException {

    public BackupFailureException(String sessionId, String message) {
        super(ErrorKind.BACKUP_FAILURE, sessionId, message);
    }

    public BackupFailureException(String sessionId, String message, Throwable cause) {
        super(ErrorKind.BACKUP_FAILURE, sessionId, message, cause);
    }
}
