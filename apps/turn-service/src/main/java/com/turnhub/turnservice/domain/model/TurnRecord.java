package com.turnhub.turnservice.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.turnhub.turnservice.domain.enums.AdvanceTrigger;
import com.turnhub.turnservice.domain.enums.OrchestratorState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 回合记录（只追加）。
 * 同一对局的 turnNumber 严格递增且连续；phase 不是 IDLE 的记录表示推进中或失败，
 * 在其解决之前阻止新的推进。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TurnRecord {

    private String sessionId;

    private int turnNumber;

    /** 编排阶段；IDLE 表示该回合已完成 */
    private OrchestratorState phase;

    /** 失败时所处的阶段，恢复时从这里继续 */
    private OrchestratorState failedPhase;

    private AdvanceTrigger trigger;

    private String preBackupRef;

    private String postBackupRef;

    private long startedAt;

    private Long completedAt;

    private String failureReason;

    /** 推进信号的尝试次数 */
    private int attempts;

    @JsonIgnore
    public boolean isResolved() {
        return phase == OrchestratorState.IDLE;
    }

    @JsonIgnore
    public boolean isFailed() {
        return phase == OrchestratorState.FAILED;
    }
}
