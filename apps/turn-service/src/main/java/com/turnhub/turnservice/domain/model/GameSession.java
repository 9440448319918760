package com.turnhub.turnservice.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.turnhub.turnservice.domain.enums.SessionPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 托管中的一局游戏。
 * 只能通过 SessionStateMachine 的迁移接口修改生命周期。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GameSession {

    /** 对局ID */
    private String id;

    /** 对局名称（同时是引擎存档目录名） */
    private String name;

    /** 地图/模组等配置（不透明，核心不解释） */
    private Map<String, Object> config;

    /** 生命周期 */
    private SessionPhase phase;

    /** 每回合默认时长（秒） */
    private long defaultTurnSeconds;

    /** 创建时间（epoch millis） */
    private long createdAt;

    /** 引擎存档工作目录 */
    private String workDir;

    /** 游戏进程是否在运行（由编排器维护） */
    private boolean processRunning;

    /** 是否启用棋钟（玩家时间银行） */
    private boolean chessClockEnabled;

    /** 棋钟初始时间（秒） */
    private long chessClockStartingSeconds;

    /** 每回合为每位玩家补充的棋钟时间（秒） */
    private long chessClockPerTurnSeconds;

    /** 每回合每位玩家最多延时次数，null 表示不限 */
    private Integer maxExtensionsPerTurn;

    @JsonIgnore
    public boolean isActive() {
        return phase != null && phase.active();
    }

    @JsonIgnore
    public boolean isStarted() {
        return phase != null && phase.started();
    }

    @JsonIgnore
    public boolean isEnded() {
        return phase != null && phase.ended();
    }
}
