package com.turnhub.turnservice.domain.enums;

/**
 * 回合编排状态机的阶段。
 * 持久化在 TurnRecord 上，进程重启后据此从最后完成的阶段继续。
 */
public enum OrchestratorState {

    IDLE,
    PRE_BACKUP_IN_FLIGHT,
    ADVANCING,
    POST_BACKUP_IN_FLIGHT,
    NOTIFYING,
    FAILED
}
