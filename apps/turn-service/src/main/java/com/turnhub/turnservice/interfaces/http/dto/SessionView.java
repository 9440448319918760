package com.turnhub.turnservice.interfaces.http.dto;

import com.turnhub.turnservice.domain.enums.OrchestratorState;
import com.turnhub.turnservice.domain.model.GameSession;
import com.turnhub.turnservice.domain.model.TimerState;

/**
 * 对局详情：生命周期、计时器与当前编排状态。
 */
public record SessionView(GameSession session,
                          TimerState timer,
                          Long deadlineEpochMs,
                          OrchestratorState orchestratorState,
                          boolean active,
                          boolean started,
                          boolean ended) {
}
