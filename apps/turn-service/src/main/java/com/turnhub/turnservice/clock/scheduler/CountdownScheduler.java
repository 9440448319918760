package com.turnhub.turnservice.clock.scheduler;

/**
 * CountdownScheduler
 * ---------------------------------------
 * 回合倒计时调度器：单个 tick 循环驱动所有运行中的计时器。
 *
 * 设计目标：
 *  - 每个 tick 按真实流逝时间扣减 remaining，归零时派发一次到期事件；
 *  - 剩余时间跨过提醒阈值时派发一次提醒事件；
 *  - 暂停的计时器永不触发；
 *  - 不关心推进/备份/通知等业务，由上层协调器负责。
 */
public interface CountdownScheduler {

    /**
     * 到期回调（每次归零只回调一次）。
     */
    interface DeadlineHandler {
        void onDeadline(String sessionId);
    }

    /**
     * 临期提醒回调（每回合只回调一次）。
     */
    interface WarningListener {
        /**
         * @param remainingSeconds 触发时的剩余秒数
         */
        void onWarning(String sessionId, long remainingSeconds);
    }

    void setDeadlineHandler(DeadlineHandler handler);

    void setWarningListener(WarningListener listener);

    /**
     * 启动 tick 循环（重复调用无副作用）。
     */
    void start();

    /**
     * 停止 tick 循环（不打断正在执行的 tick）。
     */
    void stop();

    /**
     * 执行一次 tick：结算所有运行中的计时器。被锁住的对局跳过，下个 tick 再结算。
     */
    void tick();

    /**
     * 到期事件没有被处理（例如对局被其他操作长时间占用），下一个 tick 在计时器仍处于到期状态时重新派发。
     * 计时器在此之前已被延长或重置时不再派发。
     */
    void requeueDeadline(String sessionId);

    /**
     * 从持久化状态恢复：运行中的计时器扣除停机期间真实流逝的时间，暂停的保持冻结。
     * @return 运行中的计时器数量
     */
    int restoreAll();
}
