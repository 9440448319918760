package com.turnhub.turnservice.domain.enums;

/**
 * 对局生命周期标签。
 * 对外仍暴露 active/started/ended 三个布尔位，内部只用一个枚举，
 * 合法迁移见 {@link com.turnhub.turnservice.session.SessionTransitionTable}。
 */
public enum SessionPhase {

    CREATED(true, false, false),   // 已创建（大厅，未启动进程）
    LAUNCHED(true, false, false),  // 进程已启动（标志位不变）
    STARTED(true, true, false),    // 已进入第 1 回合
    ENDED(true, true, true),       // 已结束
    DELETED(false, true, true);    // 已删除（不再托管）

    private final boolean active;
    private final boolean started;
    private final boolean ended;

    SessionPhase(boolean active, boolean started, boolean ended) {
        this.active = active;
        this.started = started;
        this.ended = ended;
    }

    public boolean active()  { return active; }
    public boolean started() { return started; }
    public boolean ended()   { return ended; }

    /** 进程可被托管（可推进回合、可被监测） */
    public boolean hosting() {
        return this == LAUNCHED || this == STARTED;
    }
}
