package com.turnhub.turnservice.interfaces.http.dto;

/**
 * 延时请求：playerId 为空表示运维直接调整（不计入玩家账本）。
 */
public record ExtendRequest(String playerId, long deltaSeconds) {
}
