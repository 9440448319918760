package com.turnhub.turnservice.process;

import com.turnhub.turnservice.domain.model.GameStatus;

import java.io.IOException;
import java.util.Optional;

/**
 * 游戏引擎进程句柄
 * ----------------------------------------
 * 只暴露编排需要的不透明契约：启动、停止、存活、推进信号、状态探测。
 * 句柄只由 GameProcessRegistry 持有，每个对局同一时刻只有一个。
 * ----------------------------------------
 */
public interface GameProcessHandle {

    String sessionId();

    void start() throws IOException;

    /** 停止进程，已退出时无操作 */
    void stop();

    boolean isAlive();

    /**
     * 请求引擎立即处理当前回合（非阻塞，确认由状态探测完成）。
     */
    void signalAdvance() throws IOException;

    /**
     * 读取引擎状态产物，尚未生成时为空。
     */
    Optional<GameStatus> probeStatus() throws IOException;

    /**
     * 引擎错误日志中的有效错误摘要（用于崩溃通知）。
     */
    String readErrorSummary();
}
