package com.turnhub.turnservice.domain.enums;

/**
 * 回合推进的入口来源。所有入口都走同一个编排流程。
 */
public enum AdvanceTrigger {

    DEADLINE,        // 计时到期
    TURN_COMPLETED,  // 监测到引擎自行推进
    FORCE,           // 运维强制推进
    RESUME,          // 运维恢复 / 重启后恢复
    PRE_HOOK,        // 外部包装器：推进前回调
    POST_HOOK;       // 外部包装器：推进后回调

    /** 自动入口遇到 FAILED 记录时不自行恢复，必须由运维处理 */
    public boolean automatic() {
        return this == DEADLINE || this == TURN_COMPLETED;
    }

    /** 引擎已经在外部完成推进，编排器不再发送推进信号 */
    public boolean externallyAdvanced() {
        return this == TURN_COMPLETED || this == POST_HOOK;
    }
}
