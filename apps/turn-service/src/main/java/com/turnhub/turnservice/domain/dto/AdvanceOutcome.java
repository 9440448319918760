package com.turnhub.turnservice.domain.dto;

import com.turnhub.turnservice.domain.enums.AdvanceTrigger;
import lombok.Builder;

import java.util.List;

/**
 * 一次回合推进的结果（返回给钩子调用方/运维接口）。
 *
 * @param alreadyCompleted 该回合此前已完成，本次调用没有产生任何副作用
 */
@Builder
public record AdvanceOutcome(
        String sessionId,
        int turnNumber,
        Long deadlineEpochMs,
        long remainingSeconds,
        List<String> outstandingPlayers,
        AdvanceTrigger trigger,
        boolean alreadyCompleted
) {
}
