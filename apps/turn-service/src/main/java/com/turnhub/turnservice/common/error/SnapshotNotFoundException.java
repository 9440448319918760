package com.turnhub.turnservice.common.error;

/** 指定回合没有可用的备份快照。 */
public class SnapshotNotFoundException extends TurnHubException {

    public SnapshotNotFoundException(String sessionId, String message) {
        super(ErrorKind.SNAPSHOT_NOT_FOUND, sessionId, message);
    }

    public SnapshotNotFoundException(String sessionId, String message, Throwable cause) {
        super(ErrorKind.SNAPSHOT_NOT_FOUND, sessionId, message, cause);
    }
}
