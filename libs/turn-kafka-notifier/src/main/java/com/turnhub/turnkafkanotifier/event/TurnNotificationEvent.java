package com.turnhub.turnkafkanotifier.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 回合通知事件。
 *
 * 由回合编排引擎产生，通过 Kafka 广播给外部聊天/展示层，
 * 展示层只负责渲染，不接触持久化，也不直接操作游戏进程。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnNotificationEvent {

    /**
     * 对局会话 ID
     */
    private String sessionId;

    /**
     * 对局名称（冗余，便于展示层直接使用）
     */
    private String sessionName;

    /**
     * 事件类型
     */
    private EventType eventType;

    /**
     * 回合号（与事件相关时填写，否则为 null）
     */
    private Integer turnNumber;

    /**
     * 下一次截止的绝对时间（毫秒），计时暂停或无计时时为 null
     */
    private Long deadlineEpochMs;

    /**
     * 距下一次截止的剩余秒数
     */
    private Long remainingSeconds;

    /**
     * 尚未提交回合的玩家（来自引擎状态文件的透传字段）
     */
    private List<String> outstandingPlayers;

    /**
     * 可选：说明/错误信息
     */
    private String message;

    /**
     * 事件触发时间（时间戳）
     */
    private Long timestamp;

    /**
     * 事件类型枚举
     */
    public enum EventType {
        /** 回合推进完成 */
        TURN_ADVANCED,
        /** 大厅进入第 1 回合 */
        GAME_STARTED,
        /** 计时即将到期（默认剩余 1 小时） */
        TIMER_WARNING,
        /** 回合推进失败，需要运维介入 */
        ADVANCE_FAILED,
        /** 游戏进程意外退出 */
        PROCESS_DIED,
        /** 已回滚到历史回合 */
        ROLLED_BACK
    }

    /**
     * 创建只带说明的事件（自动设置时间戳）
     */
    public static TurnNotificationEvent of(String sessionId, String sessionName, EventType eventType, String message) {
        return TurnNotificationEvent.builder()
                .sessionId(sessionId)
                .sessionName(sessionName)
                .eventType(eventType)
                .message(message)
                .timestamp(Instant.now().toEpochMilli())
                .build();
    }
}
