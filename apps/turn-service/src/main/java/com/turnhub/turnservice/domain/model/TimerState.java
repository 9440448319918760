package com.turnhub.turnservice.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对局的回合计时状态（与 GameSession 一一对应）。
 * - remainingMs 始终 >= 0；
 * - running=false 时 remainingMs 冻结，恢复时暂停期间的时间不计入；
 * - deadlineFired / warningSent 是边沿触发的闩锁，避免重复派发。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TimerState {

    private String sessionId;

    /** 剩余毫秒 */
    private long remainingMs;

    private boolean running;

    /** 暂停时刻（epoch millis），运行中为 null */
    private Long pausedAtEpochMs;

    /** 上一次结算的时刻（epoch millis） */
    private long lastTickEpochMs;

    /** 本次归零是否已派发过到期事件 */
    private boolean deadlineFired;

    /** 本回合是否已发送过临期提醒 */
    private boolean warningSent;

    /** 下一回合的一次性时长覆盖（秒），用完即清 */
    private Long nextTurnOverrideSeconds;

    @JsonIgnore
    public long remainingSeconds() {
        return remainingMs / 1000;
    }

    /**
     * 按当前时刻结算：运行中则扣除自上次结算以来的真实耗时，钳制到 0。
     */
    public void settle(long nowMs) {
        if (running) {
            long elapsed = nowMs - lastTickEpochMs;
            if (elapsed > 0) {
                remainingMs = Math.max(0, remainingMs - elapsed);
            }
        }
        lastTickEpochMs = nowMs;
    }
}
