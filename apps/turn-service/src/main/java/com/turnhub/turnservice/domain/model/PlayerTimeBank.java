package com.turnhub.turnservice.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 玩家时间银行（棋钟），按 (session, player) 记账。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PlayerTimeBank {

    private String sessionId;

    private String playerId;

    /** 玩家控制的国家 */
    private String nation;

    /** 可用余额（秒），>= 0 */
    private long balanceSeconds;

    /** 本回合已使用的延时次数 */
    private int extensionsUsedThisTurn;

    /** 每回合延时次数上限，null 表示不限 */
    private Integer maxExtensionsPerTurn;

    /** 累计延时秒数（统计用） */
    private long totalExtensionSeconds;
}
