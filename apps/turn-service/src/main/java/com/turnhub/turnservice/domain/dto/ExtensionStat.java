package com.turnhub.turnservice.domain.dto;

/**
 * 单个玩家的延时统计。
 */
public record ExtensionStat(String playerId, String nation, long totalExtensionSeconds,
                            int extensionsUsedThisTurn, long balanceSeconds) {
}
